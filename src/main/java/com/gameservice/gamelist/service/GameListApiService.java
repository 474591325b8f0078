package com.gameservice.gamelist.service;

import com.gameservice.gamelist.model.GameDTO;
import com.gameservice.gamelist.model.GameListConverter;
import com.gameservice.websocketcore.model.GameSession;
import com.gameservice.websocketcore.model.GameSessionRegistry;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

@Service
public class GameListApiService implements IGameListApiService {

	private final GameListConverter gameListConverter;
	private final GameSessionRegistry gameSessionRegistry;

	public GameListApiService(
			GameListConverter gameListConverter,
			GameSessionRegistry gameSessionRegistry) {
		this.gameListConverter = gameListConverter;
		this.gameSessionRegistry = gameSessionRegistry;
	}

	@Override
	public List<GameDTO> getGameList() {
		// 1. 살아 있는 세션 조회(생성 시각 순)
		List<GameSession> sessions = gameSessionRegistry.getSessions();
		sessions.sort(Comparator.comparing(GameSession::getCreatedAt));
		// 2. 변환기로 DTO 리스트 변환 후 반환
		return gameListConverter.toDtoList(sessions);
	}

	/* 없는 토큰이면 GameNotFoundException → GameListExceptionHandler 에서 404 */
	@Override
	public GameDTO getGame(String joinToken) {
		return gameListConverter.toDto(gameSessionRegistry.lookup(joinToken));
	}
}
