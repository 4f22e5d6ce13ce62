package com.my.callsync.domain.model;

import java.util.Locale;

/**
 * 외부 캘린더 이벤트의 생명주기 상태.
 */
public enum EventStatus {
    CONFIRMED,
    TENTATIVE,
    CANCELLED;

    public static EventStatus fromProvider(String value) {
        if (value == null) {
            return CONFIRMED;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "cancelled" -> CANCELLED;
            case "tentative" -> TENTATIVE;
            default -> CONFIRMED;
        };
    }
}
