package com.gameservice.engine;

import com.gameservice.engine.exception.IllegalMoveException;
import com.gameservice.websocketcore.model.Role;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * @class ConnectFour
 * @brief 7열 x 6행 사목(Connect Four) 규칙 구현.
 *
 * - PLAYER1 선공, 이후 번갈아 착수
 * - 돌은 해당 열의 가장 낮은 빈 행(0 부터)에 놓인다
 * - 가로/세로/대각선 4 연속이면 승리, 승리 이후 착수는 모두 거부
 */
public class ConnectFour implements GameEngine {

    public static final int COLUMNS = 7;
    public static final int ROWS = 6;
    private static final int CONNECT = 4;

    /** board[column][row], 비어 있으면 null */
    private final Role[][] board = new Role[COLUMNS][ROWS];
    /** 열별 다음 착수 행 */
    private final int[] top = new int[COLUMNS];
    private final List<Move> moves = new ArrayList<>();

    private Role lastPlayer;
    private Role winner;

    @Override
    public int applyMove(Role player, int column) {
        if (player == null || !player.isPlayer()) {
            throw new IllegalMoveException("Spectators cannot play.");
        }
        if (winner != null) {
            throw new IllegalMoveException("Game is over.");
        }
        // 첫 수는 PLAYER1
        Role expected = (lastPlayer == null) ? Role.PLAYER1 : lastPlayer.opponent();
        if (player != expected) {
            throw new IllegalMoveException("It isn't your turn.");
        }
        if (column < 0 || column >= COLUMNS) {
            throw new IllegalMoveException("Illegal column.");
        }
        int row = top[column];
        if (row >= ROWS) {
            throw new IllegalMoveException("This slot is full.");
        }

        board[column][row] = player;
        top[column] = row + 1;
        lastPlayer = player;
        moves.add(new Move(player, column, row));

        if (isWinningMove(player, column, row)) {
            winner = player;
        }
        return row;
    }

    @Override
    public Optional<Role> winner() {
        return Optional.ofNullable(winner);
    }

    @Override
    public List<Move> moves() {
        return Collections.unmodifiableList(new ArrayList<>(moves));
    }

    private boolean isWinningMove(Role player, int column, int row) {
        // 가로, 세로, 대각선(/), 대각선(\)
        return count(player, column, row, 1, 0) >= CONNECT
                || count(player, column, row, 0, 1) >= CONNECT
                || count(player, column, row, 1, 1) >= CONNECT
                || count(player, column, row, 1, -1) >= CONNECT;
    }

    /* (column,row) 를 포함해 (dc,dr) 축 양방향으로 연속된 같은 돌 개수 */
    private int count(Role player, int column, int row, int dc, int dr) {
        int total = 1;
        for (int sign = -1; sign <= 1; sign += 2) {
            int c = column + sign * dc;
            int r = row + sign * dr;
            while (c >= 0 && c < COLUMNS && r >= 0 && r < ROWS && board[c][r] == player) {
                total++;
                c += sign * dc;
                r += sign * dr;
            }
        }
        return total;
    }
}
