package com.my.callsync.domain.service;

import com.my.callsync.domain.exception.InvalidRequestException;
import com.my.callsync.domain.exception.ProviderException;
import com.my.callsync.domain.model.TokenGrant;
import com.my.callsync.domain.port.in.CalendarConnectionUseCase;
import com.my.callsync.domain.port.out.CredentialStorePort;
import com.my.callsync.domain.port.out.OAuthTokenPort;

/**
 * 왜: 인증 링크 발급, 인가 코드 교환, 연결 해제를 도메인 계약으로 묶어 어댑터가 토큰 저장 규칙을 알 필요가 없게 하기 위함.
 */
public class CalendarConnectionService implements CalendarConnectionUseCase {

    private final OAuthTokenPort tokenPort;
    private final TokenVault tokenVault;
    private final CredentialStorePort credentialStore;

    public CalendarConnectionService(OAuthTokenPort tokenPort, TokenVault tokenVault, CredentialStorePort credentialStore) {
        this.tokenPort = tokenPort;
        this.tokenVault = tokenVault;
        this.credentialStore = credentialStore;
    }

    @Override
    public String authorizationUrl(String userId) {
        requireUser(userId);
        return tokenPort.authorizationUrl(userId);
    }

    @Override
    public void connect(String userId, String authorizationCode) {
        requireUser(userId);
        if (authorizationCode == null || authorizationCode.isBlank()) {
            throw new InvalidRequestException("인가 코드가 비어 있습니다.");
        }
        TokenGrant grant;
        try {
            grant = tokenPort.exchangeCode(authorizationCode.trim());
        } catch (ProviderException e) {
            if (e.status() >= 400 && e.status() < 500) {
                throw new InvalidRequestException("인가 코드가 거부되었습니다. 다시 인증해주세요.", e);
            }
            throw e;
        }
        tokenVault.store(userId, grant);
    }

    @Override
    public void disconnect(String userId) {
        requireUser(userId);
        tokenVault.revoke(userId);
    }

    @Override
    public boolean isConnected(String userId) {
        return credentialStore.find(userId).isPresent();
    }

    private void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidRequestException("userId가 필요합니다.");
        }
    }
}
