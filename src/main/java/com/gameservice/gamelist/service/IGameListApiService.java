package com.gameservice.gamelist.service;

import com.gameservice.gamelist.model.GameDTO;

import java.util.List;

public interface IGameListApiService {

	List<GameDTO> getGameList();

	GameDTO getGame(String joinToken);
}
