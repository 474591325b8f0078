package com.gameservice.config;

import com.gameservice.engine.ConnectFour;
import com.gameservice.engine.GameEngineFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 게임 서비스 공통 빈 설정
 *
 * - gameEngineFactory       : 세션마다 새 ConnectFour 엔진
 * - connectionCloseExecutor : 브로드캐스트 전송 실패 연결을 비동기로 닫는 전용 스레드 풀
 */
@Configuration
public class GameServiceConfig {

    @Value("${gameservice.close-executor.pool-size:2}")
    private int closePoolSize;

    @Bean
    public GameEngineFactory gameEngineFactory() {
        return ConnectFour::new;
    }

    @Bean(name = "connectionCloseExecutor", destroyMethod = "shutdown")
    public ExecutorService connectionCloseExecutor() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "connection-close-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        return new ThreadPoolExecutor(closePoolSize, closePoolSize, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), tf);
    }
}
