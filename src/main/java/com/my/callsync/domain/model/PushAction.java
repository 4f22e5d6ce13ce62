package com.my.callsync.domain.model;

import com.my.callsync.domain.exception.InvalidRequestException;

import java.util.Locale;

public enum PushAction {
    CREATE,
    UPDATE,
    DELETE;

    public static PushAction parse(String value) {
        if (value == null) {
            throw new InvalidRequestException("action이 비어 있습니다.");
        }
        try {
            return PushAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("지원하지 않는 action입니다: " + value, e);
        }
    }
}
