package com.gameservice.websocketcore.core;

import com.gameservice.codec.GameEventCodec;
import com.gameservice.websocketcore.model.GameSessionRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

	@Value("${gameservice.websocket.path:/game}")
	private String path;

	@Value("${gameservice.websocket.allowed-origins:*}")
	private String[] allowedOrigins;

	/* 느린 클라이언트 1개가 브로드캐스트 전체를 붙잡지 않도록 전송 시간/버퍼 제한 */
	@Value("${gameservice.websocket.send-time-limit-ms:5000}")
	private int sendTimeLimitMillis;

	@Value("${gameservice.websocket.send-buffer-size-limit:65536}")
	private int sendBufferSizeLimit;

	private final GameSessionRegistry gameSessionRegistry;
	private final GameEventCodec gameEventCodec;

	public WebSocketConfig(
			GameSessionRegistry gameSessionRegistry,
			GameEventCodec gameEventCodec) {

		this.gameSessionRegistry = gameSessionRegistry;
		this.gameEventCodec = gameEventCodec;
	}

	@Override
	public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
		registry.addHandler(gameWebSocketHandler(), path)
				.setAllowedOrigins(allowedOrigins);
	}

	@Bean
	public WebSocketHandler gameWebSocketHandler() {
		return new GameTextWebSocketHandler(gameSessionRegistry, gameEventCodec, sendTimeLimitMillis, sendBufferSizeLimit);
	}
}
