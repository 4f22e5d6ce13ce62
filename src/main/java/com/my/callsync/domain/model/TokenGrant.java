package com.my.callsync.domain.model;

import java.util.Objects;

/**
 * 왜: 토큰 엔드포인트 응답을 SDK 타입과 분리해 도메인이 저장/갱신 규칙만 다루도록 하기 위함.
 */
public record TokenGrant(String accessToken, String refreshToken, long expiresInSeconds) {

    public static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    public TokenGrant {
        Objects.requireNonNull(accessToken, "accessToken");
        if (expiresInSeconds <= 0) {
            expiresInSeconds = DEFAULT_EXPIRES_IN_SECONDS;
        }
    }

    @Override
    public String toString() {
        return "TokenGrant[expiresInSeconds=" + expiresInSeconds + ", refreshTokenPresent="
                + (refreshToken != null && !refreshToken.isBlank()) + "]";
    }
}
