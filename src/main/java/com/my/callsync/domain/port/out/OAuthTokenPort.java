package com.my.callsync.domain.port.out;

import com.my.callsync.domain.model.TokenGrant;

/**
 * 왜: 공급자 토큰 엔드포인트(인가 코드 교환, 리프레시 토큰 그랜트)를 도메인에서 분리하기 위함.
 * <p>
 * 실패는 {@link com.my.callsync.domain.exception.ProviderException}으로 표현한다.
 */
public interface OAuthTokenPort {

    /**
     * 오프라인 접근과 동의 화면 강제를 포함한 인증 URL. state는 콜백에서 사용자를 식별하는 데 쓰인다.
     */
    String authorizationUrl(String state);

    TokenGrant exchangeCode(String authorizationCode);

    TokenGrant refresh(String refreshToken);
}
