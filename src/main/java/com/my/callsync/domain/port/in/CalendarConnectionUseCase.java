package com.my.callsync.domain.port.in;

/**
 * 왜: 캘린더 연결 수명 주기(인증 링크, 코드 교환, 연결 해제)를 하나의 계약으로 묶기 위함.
 */
public interface CalendarConnectionUseCase {

    String authorizationUrl(String userId);

    void connect(String userId, String authorizationCode);

    void disconnect(String userId);

    boolean isConnected(String userId);
}
