package com.gameservice.websocketcore.model;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * @class SessionTokenGenerator
 * @brief 추측 불가능한 URL-safe 세션 토큰 발급기(SecureRandom + Base64URL, 패딩 없음).
 *        기본 16바이트 = 128비트 엔트로피.
 */
@Component
public class SessionTokenGenerator {

    private static final int MIN_TOKEN_BYTES = 12;

    private final SecureRandom random = new SecureRandom();
    private final int tokenBytes;

    public SessionTokenGenerator(@Value("${gameservice.token.bytes:16}") int tokenBytes) {
        if (tokenBytes < MIN_TOKEN_BYTES) {
            throw new IllegalArgumentException("gameservice.token.bytes must be >= " + MIN_TOKEN_BYTES);
        }
        this.tokenBytes = tokenBytes;
    }

    public String nextToken() {
        byte[] buf = new byte[tokenBytes];
        random.nextBytes(buf);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buf);
    }
}
