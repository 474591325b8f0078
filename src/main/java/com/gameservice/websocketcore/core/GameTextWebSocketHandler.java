package com.gameservice.websocketcore.core;

import com.gameservice.codec.GameEventCodec;
import com.gameservice.codec.exception.DecodeException;
import com.gameservice.codec.exception.ProtocolException;
import com.gameservice.codec.model.ErrorEvent;
import com.gameservice.codec.model.EventType;
import com.gameservice.codec.model.GameEvent;
import com.gameservice.codec.model.InitRequest;
import com.gameservice.codec.model.InitResponse;
import com.gameservice.codec.model.PlayRequest;
import com.gameservice.engine.exception.IllegalMoveException;
import com.gameservice.websocketcore.exception.EngineFaultException;
import com.gameservice.websocketcore.exception.GameNotFoundException;
import com.gameservice.websocketcore.model.Attachment;
import com.gameservice.websocketcore.model.ConnectionContext;
import com.gameservice.websocketcore.model.ConnectionState;
import com.gameservice.websocketcore.model.GameSession;
import com.gameservice.websocketcore.model.GameSessionRegistry;
import com.gameservice.websocketcore.model.MoveResult;
import com.gameservice.websocketcore.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * @class GameTextWebSocketHandler
 * @brief 연결별 상태 머신(INIT → ACTIVE → CLOSED)을 구동하는 WebSocket 핸들러.
 *
 * [상태별 처리]
 * - INIT   : 첫 메시지는 반드시 init. 생성(create) / 참가(join) / 관전(watch) 중 하나로 세션에 attach 후 ACTIVE.
 * - ACTIVE : 플레이어의 play 만 허용. 규칙 위반은 요청 연결에만 error, 승부가 나면 세션 전체 종료.
 * - CLOSED : 이후 수신 메시지는 무시. 진입 경로와 관계없이 detach 수행.
 *
 * [오류 처리]
 * - GameNotFound / IllegalMove : 요청 연결에 error 전송, 세션 영향 없음
 * - Decode / Protocol          : error 전송 후 해당 연결만 종료(BAD_DATA / POLICY_VIOLATION)
 * - EngineFault                : 로그 후 해당 연결만 종료(SERVER_ERROR), 남은 참여자가 있으면 세션 유지
 *
 * @called_by WebSocketConfig.registerWebSocketHandlers()
 */
public class GameTextWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(GameTextWebSocketHandler.class);

    static final String CONTEXT_ATTRIBUTE = "connectionContext";

    private final GameSessionRegistry gameSessionRegistry;
    private final GameEventCodec gameEventCodec;
    private final int sendTimeLimitMillis;
    private final int sendBufferSizeLimit;

    public GameTextWebSocketHandler(
            GameSessionRegistry gameSessionRegistry,
            GameEventCodec gameEventCodec,
            int sendTimeLimitMillis,
            int sendBufferSizeLimit) {

        this.gameSessionRegistry = gameSessionRegistry;
        this.gameEventCodec = gameEventCodec;
        this.sendTimeLimitMillis = sendTimeLimitMillis;
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }

    // =========================================================================
    // 1. [연결 수립/종료 콜백]
    // =========================================================================

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession concurrentSession =
                new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis, sendBufferSizeLimit);
        ConnectionContext context = new ConnectionContext(new WebSocketGameConnection(concurrentSession, gameEventCodec));
        session.getAttributes().put(CONTEXT_ATTRIBUTE, context);

        logger.info("[연결 수립] connectionId={}, remote={}", session.getId(), session.getRemoteAddress());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ConnectionContext context = (ConnectionContext) session.getAttributes().get(CONTEXT_ATTRIBUTE);
        if (context == null) {
            return;
        }
        if (context.close()) {
            logger.info("[연결 종료] connectionId={}, status={}", session.getId(), status);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.warn("[전송 오류] connectionId={}, error={}", session.getId(), exception.getMessage());
        ConnectionContext context = (ConnectionContext) session.getAttributes().get(CONTEXT_ATTRIBUTE);
        if (context == null) {
            return;
        }
        context.close();
        context.getConnection().close(CloseStatus.SERVER_ERROR);
    }

    // =========================================================================
    // 2. [메시지 수신]
    // =========================================================================

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ConnectionContext context = contextOf(session);
        if (context.getState() == ConnectionState.CLOSED) {
            logger.debug("[수신 무시] CLOSED 연결: connectionId={}", session.getId());
            return;
        }

        GameEvent event;
        try {
            event = gameEventCodec.decode(message.getPayload());
        } catch (DecodeException e) {
            abort(context, e.getMessage(), CloseStatus.BAD_DATA);
            return;
        } catch (ProtocolException e) {
            abort(context, e.getMessage(), CloseStatus.POLICY_VIOLATION);
            return;
        }

        try {
            if (context.getState() == ConnectionState.INIT) {
                handleInit(context, event);
            } else {
                handleActive(context, event);
            }
        } catch (ProtocolException e) {
            abort(context, e.getMessage(), CloseStatus.POLICY_VIOLATION);
        } catch (EngineFaultException e) {
            logger.error("[엔진 오류] connectionId={}", session.getId(), e);
            abort(context, EngineFaultException.CLIENT_MESSAGE, CloseStatus.SERVER_ERROR);
        }
    }

    private void handleInit(ConnectionContext context, GameEvent event) {
        if (event.getType() != EventType.INIT) {
            throw new ProtocolException("Expected init event.");
        }
        InitRequest init = (InitRequest) event;

        if (init.isCreate()) {
            startGame(context);
        } else if (init.isJoin()) {
            attachExisting(context, init.getJoinToken(), Role.PLAYER2, false);
        } else if (init.isWatch()) {
            attachExisting(context, init.getWatchToken(), Role.SPECTATOR, true);
        } else {
            throw new ProtocolException("Cannot join and watch at the same time.");
        }
    }

    private void handleActive(ConnectionContext context, GameEvent event) {
        if (event.getType() != EventType.PLAY) {
            throw new ProtocolException("Unexpected event type: " + event.getType().getTag());
        }
        Attachment attachment = context.getAttachment()
                .orElseThrow(() -> new IllegalStateException("ACTIVE 연결에 참여권 없음"));

        if (!attachment.getRole().isPlayer()) {
            sendError(context, "Spectators cannot play.");
            return;
        }

        GameSession gameSession = attachment.getSession();
        int column = ((PlayRequest) event).getColumn();
        MoveResult result;
        try {
            result = gameSession.applyMove(attachment.getRole(), column);
        } catch (IllegalMoveException e) {
            logger.warn("[착수 거부] joinToken={}, role={}, column={}, reason={}",
                    gameSession.getJoinToken(), attachment.getRole(), column, e.getMessage());
            sendError(context, e.getMessage());
            return;
        }

        if (result.isWinning()) {
            logger.info("[게임 종료] joinToken={}, winner={}", gameSession.getJoinToken(), result.getPlayer());
            gameSession.terminate(CloseStatus.NORMAL);
            context.close();
        }
    }

    // =========================================================================
    // 3. [세션 생성/참가/관전]
    // =========================================================================

    private void startGame(ConnectionContext context) {
        GameSession gameSession = gameSessionRegistry.create();
        Attachment attachment;
        try {
            attachment = gameSession.attach(context.getConnection(), Role.PLAYER1);
        } catch (RuntimeException e) {
            gameSessionRegistry.release(gameSession.getJoinToken());
            throw e;
        }
        if (!activate(context, attachment)) {
            return;
        }
        send(context, new InitResponse(gameSession.getJoinToken(), gameSession.getWatchToken()));
    }

    private void attachExisting(ConnectionContext context, String token, Role requestedRole, boolean watch) {
        Attachment attachment;
        try {
            GameSession gameSession = watch
                    ? gameSessionRegistry.lookupWatch(token)
                    : gameSessionRegistry.lookup(token);
            attachment = gameSession.attach(context.getConnection(), requestedRole);
        } catch (GameNotFoundException e) {
            logger.warn("[세션 없음] connectionId={}, watch={}", context.getConnection().getId(), watch);
            sendError(context, e.getMessage());
            context.close();
            context.getConnection().close(CloseStatus.NORMAL);
            return;
        }
        activate(context, attachment);
    }

    private boolean activate(ConnectionContext context, Attachment attachment) {
        if (!context.activate(attachment)) {
            attachment.close();
            return false;
        }
        logger.info("[ACTIVE] connectionId={}, joinToken={}, role={}",
                context.getConnection().getId(), attachment.getSession().getJoinToken(), attachment.getRole());
        return true;
    }

    // =========================================================================
    // 4. [전송/종료 유틸]
    // =========================================================================

    /* error 전송 후 해당 연결만 종료 */
    private void abort(ConnectionContext context, String reason, CloseStatus status) {
        logger.warn("[연결 중단] connectionId={}, status={}, reason={}", context.getConnection().getId(), status, reason);
        sendError(context, reason);
        context.close();
        context.getConnection().close(status);
    }

    private void sendError(ConnectionContext context, String message) {
        send(context, new ErrorEvent(message));
    }

    private void send(ConnectionContext context, GameEvent event) {
        try {
            context.getConnection().send(event);
        } catch (Exception e) {
            logger.warn("[전송 실패] connectionId={}, type={}, error={}",
                    context.getConnection().getId(), event.getType(), e.getMessage());
            context.getConnection().close(CloseStatus.SESSION_NOT_RELIABLE);
        }
    }

    private ConnectionContext contextOf(WebSocketSession session) {
        ConnectionContext context = (ConnectionContext) session.getAttributes().get(CONTEXT_ATTRIBUTE);
        if (context == null) {
            throw new IllegalStateException("연결 컨텍스트 없음: connectionId=" + session.getId());
        }
        return context;
    }
}
