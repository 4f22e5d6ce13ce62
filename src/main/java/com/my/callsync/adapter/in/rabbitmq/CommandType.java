package com.my.callsync.adapter.in.rabbitmq;

import com.my.callsync.domain.exception.InvalidRequestException;

import java.util.Locale;

public enum CommandType {
    AUTH_URL,
    CONNECT,
    DISCONNECT,
    SYNC,
    PUSH,
    CONFIRM_CONTACTS,
    AVAILABILITY;

    static CommandType parse(String value) {
        try {
            return CommandType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("지원하지 않는 명령입니다: " + value, e);
        }
    }
}
