package com.my.callsync.domain.exception;

/**
 * 삭제 대상이 이미 사라진 경우(404/410). 호출자는 성공으로 취급한다.
 */
public class NotFoundIgnorableException extends ProviderException {

    public NotFoundIgnorableException(int status, String externalEventId) {
        super(status, "외부 이벤트가 이미 존재하지 않습니다: " + externalEventId);
    }

    public static boolean matches(int status) {
        return status == 404 || status == 410;
    }
}
