package com.gameservice.gamelist.model;

import com.gameservice.websocketcore.model.GameSession;
import com.gameservice.websocketcore.model.Role;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/* GameSession → 조회용 DTO 변환. 관전 토큰은 노출하지 않는다. */
@Component
public class GameListConverter {

	public GameDTO toDto(GameSession session) {
		List<String> players = session.getSeatedPlayers().stream()
				.map(Role::getWireName)
				.collect(Collectors.toList());

		return new GameDTO(
				session.getJoinToken(),
				players,
				session.getSpectatorCount(),
				session.getMoveCount(),
				session.isFinished(),
				session.getCreatedAt());
	}

	public List<GameDTO> toDtoList(List<GameSession> sessions) {
		return sessions.stream()
				.map(this::toDto)
				.collect(Collectors.toList());
	}
}
