package com.my.callsync.domain.exception;

/**
 * 왜: 자격 증명 행이 없을 때 상위 계층이 연결 안내로 분기할 수 있도록 하기 위함.
 */
public class AuthNotConnectedException extends RuntimeException {

    private final String userId;

    public AuthNotConnectedException(String userId) {
        super("Google Calendar가 연결되지 않았습니다: userId=" + userId);
        this.userId = userId;
    }

    public String userId() {
        return userId;
    }
}
