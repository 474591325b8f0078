package com.gameservice.gamelist.controller;

import java.util.List;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import com.gameservice.gamelist.model.GameDTO;
import com.gameservice.gamelist.service.IGameListApiService;

/* 운영 확인용 진행 중 게임 목록 조회 API (읽기 전용) */
@RestController
public class GameListApiController {

	private final IGameListApiService gameListApiService;

	public GameListApiController(IGameListApiService gameListApiService) {
		this.gameListApiService = gameListApiService;
	}

	@GetMapping("/api/games")
	public List<GameDTO> apiGames() {

		return gameListApiService.getGameList();
	}

	@GetMapping("/api/games/{joinToken}")
	public GameDTO apiGame(@PathVariable("joinToken") String joinToken) {

		return gameListApiService.getGame(joinToken);
	}
}
