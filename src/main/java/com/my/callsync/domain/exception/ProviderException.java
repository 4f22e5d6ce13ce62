package com.my.callsync.domain.exception;

/**
 * 왜: 외부 캘린더 공급자의 실패를 HTTP 상태 코드와 함께 전달해 호출자가 재시도 여부를 판단하도록 하기 위함.
 * <p>
 * status 0은 HTTP 응답 없이 전송 단계에서 실패한 경우다.
 */
public class ProviderException extends RuntimeException {

    public static final int TRANSPORT_FAILURE = 0;

    private final int status;

    public ProviderException(int status, String message) {
        super(message);
        this.status = status;
    }

    public ProviderException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int status() {
        return status;
    }

    /**
     * 5xx, 429, 전송 실패는 호출자가 재시도할 수 있다. 그 외 4xx는 치명적이다.
     */
    public boolean isRetryable() {
        return status == TRANSPORT_FAILURE || status == 429 || status >= 500;
    }
}
