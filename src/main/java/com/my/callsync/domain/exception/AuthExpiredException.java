package com.my.callsync.domain.exception;

/**
 * 토큰 갱신 실패. 자동 재시도하지 않으며 사용자가 다시 연결해야 한다.
 */
public class AuthExpiredException extends RuntimeException {

    private final String userId;

    public AuthExpiredException(String userId, Throwable cause) {
        super("Google 토큰 갱신에 실패했습니다. 다시 연결해주세요: userId=" + userId, cause);
        this.userId = userId;
    }

    public String userId() {
        return userId;
    }
}
