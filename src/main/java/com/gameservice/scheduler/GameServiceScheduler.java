package com.gameservice.scheduler;

import com.gameservice.websocketcore.model.GameSessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class GameServiceScheduler {

	private static final Logger logger = LoggerFactory.getLogger(GameServiceScheduler.class);

	private final GameSessionRegistry gameSessionRegistry;

	public GameServiceScheduler(GameSessionRegistry gameSessionRegistry) {
		this.gameSessionRegistry = gameSessionRegistry;
	}

	/**
	 * [닫힌 연결 정리]
	 *
	 * - 전송 계층은 끊겼는데 afterConnectionClosed 가 오지 않은 연결을 detach
	 * - 그 결과 비게 된 세션은 레지스트리에서 해제됨
	 */
	@Scheduled(fixedRateString = "${gameservice.reaper.interval-ms:30000}")
	public void reapStaleConnections() {
		if (gameSessionRegistry.size() == 0) {
			return;
		}
		try {
			int reaped = gameSessionRegistry.reapStaleConnections();
			if (reaped > 0) {
				logger.info("[reapStaleConnections] 닫힌 연결 정리: {}건, 남은 세션 수={}", reaped, gameSessionRegistry.size());
			}
		} catch (Exception e) {
			logger.error("[reapStaleConnections] 실행 중 예외 발생", e);
		}
	}
}
