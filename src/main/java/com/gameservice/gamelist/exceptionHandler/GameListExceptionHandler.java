package com.gameservice.gamelist.exceptionHandler;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.gameservice.websocketcore.exception.GameNotFoundException;

@RestControllerAdvice(basePackages = "com.gameservice.gamelist.controller")
public class GameListExceptionHandler {

	private static final Logger logger = LoggerFactory.getLogger(GameListExceptionHandler.class);

	/* 종료(해제)되었거나 존재하지 않는 토큰 조회 */
	@ExceptionHandler(GameNotFoundException.class)
	public ResponseEntity<Map<String, String>> handleGameNotFound(GameNotFoundException ex) {
		logger.debug("[handleGameNotFound] {}", ex.getMessage());
		return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("message", ex.getMessage()));
	}
}
