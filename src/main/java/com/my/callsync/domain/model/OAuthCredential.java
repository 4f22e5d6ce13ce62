package com.my.callsync.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 사용자별 OAuth 자격 증명. 사용자당 한 건만 존재한다.
 */
public record OAuthCredential(
        String userId,
        String accessToken,
        String refreshToken,
        Instant expiresAt,
        String calendarId
) {
    public static final String DEFAULT_CALENDAR_ID = "primary";

    public OAuthCredential {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(expiresAt, "expiresAt");
        refreshToken = refreshToken == null ? "" : refreshToken;
        calendarId = calendarId == null || calendarId.isBlank() ? DEFAULT_CALENDAR_ID : calendarId;
    }

    /**
     * 만료 시각에서 skew 만큼 앞당긴 시점을 지났는지 판단한다.
     */
    public boolean expiresWithin(Instant now, Duration skew) {
        return now.isAfter(expiresAt.minus(skew));
    }

    public boolean hasRefreshToken() {
        return !refreshToken.isBlank();
    }

    public OAuthCredential withAccessToken(String newAccessToken, String newRefreshToken, Instant newExpiresAt) {
        String refresh = newRefreshToken == null || newRefreshToken.isBlank() ? refreshToken : newRefreshToken;
        return new OAuthCredential(userId, newAccessToken, refresh, newExpiresAt, calendarId);
    }

    @Override
    public String toString() {
        return "OAuthCredential[userId=" + userId + ", expiresAt=" + expiresAt + ", calendarId=" + calendarId + "]";
    }
}
