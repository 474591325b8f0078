package com.gameservice.gamelist.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data					// setter / getter 생성
@NoArgsConstructor
@AllArgsConstructor
public class GameDTO {

	private String joinToken;
	private List<String> players;		// 착석 중인 플레이어 역할(Player1 / Player2)
	private int spectators;
	private int moves;
	private boolean finished;
	private LocalDateTime createdAt;
}
