package com.my.callsync.domain.service;

import com.my.callsync.domain.exception.AuthExpiredException;
import com.my.callsync.domain.exception.AuthNotConnectedException;
import com.my.callsync.domain.model.OAuthCredential;
import com.my.callsync.domain.model.TokenGrant;
import com.my.callsync.domain.port.out.ClockPort;
import com.my.callsync.domain.port.out.CredentialStorePort;
import com.my.callsync.domain.port.out.OAuthTokenPort;
import com.my.callsync.domain.port.out.UserLeasePort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;

/**
 * 왜: 사용자별 OAuth 자격 증명의 저장, 만료 전 갱신, 폐기를 한 곳에서 관리해 동시 갱신 경쟁을 막기 위함.
 * <p>
 * 갱신은 사용자별 리스 안에서만 수행한다. 리스를 얻은 뒤 저장소를 다시 읽어, 다른 작업자가 이미 갱신했다면 토큰 엔드포인트를 호출하지 않는다.
 */
public class TokenVault {

    private static final Logger log = Logger.getLogger(TokenVault.class);

    private final CredentialStorePort credentialStore;
    private final OAuthTokenPort tokenPort;
    private final UserLeasePort leasePort;
    private final ClockPort clockPort;
    private final Duration refreshSkew;

    public TokenVault(CredentialStorePort credentialStore,
                      OAuthTokenPort tokenPort,
                      UserLeasePort leasePort,
                      ClockPort clockPort,
                      Duration refreshSkew) {
        this.credentialStore = credentialStore;
        this.tokenPort = tokenPort;
        this.leasePort = leasePort;
        this.clockPort = clockPort;
        this.refreshSkew = refreshSkew;
    }

    public OAuthCredential get(String userId) {
        return credentialStore.find(userId)
                .orElseThrow(() -> new AuthNotConnectedException(userId));
    }

    public OAuthCredential ensureFresh(OAuthCredential credential) {
        if (!credential.expiresWithin(clockPort.now(), refreshSkew)) {
            return credential;
        }
        try (UserLeasePort.Lease ignored = leasePort.acquire(refreshLeaseKey(credential.userId()))) {
            OAuthCredential current = credentialStore.find(credential.userId())
                    .orElseThrow(() -> new AuthNotConnectedException(credential.userId()));
            Instant now = clockPort.now();
            if (!current.expiresWithin(now, refreshSkew)) {
                log.debugf("다른 작업자가 이미 토큰을 갱신했습니다: userId=%s", credential.userId());
                return current;
            }
            if (!current.hasRefreshToken()) {
                throw new AuthExpiredException(credential.userId(), null);
            }
            TokenGrant grant;
            try {
                grant = tokenPort.refresh(current.refreshToken());
            } catch (RuntimeException e) {
                log.warnf("토큰 갱신 실패: userId=%s, cause=%s", credential.userId(), e.getMessage());
                throw new AuthExpiredException(credential.userId(), e);
            }
            OAuthCredential refreshed = current.withAccessToken(
                    grant.accessToken(),
                    grant.refreshToken(),
                    now.plusSeconds(grant.expiresInSeconds())
            );
            credentialStore.save(refreshed);
            log.infof("토큰을 갱신했습니다: userId=%s, expiresAt=%s", refreshed.userId(), refreshed.expiresAt());
            return refreshed;
        }
    }

    /**
     * 사용자당 한 행으로 저장한다. 응답에 리프레시 토큰이 없으면 기존 값을 유지한다.
     */
    public OAuthCredential store(String userId, TokenGrant grant) {
        Instant expiresAt = clockPort.now().plusSeconds(grant.expiresInSeconds());
        OAuthCredential credential = credentialStore.find(userId)
                .map(existing -> existing.withAccessToken(grant.accessToken(), grant.refreshToken(), expiresAt))
                .orElseGet(() -> new OAuthCredential(userId, grant.accessToken(), grant.refreshToken(), expiresAt, null));
        if (!credential.hasRefreshToken()) {
            log.warnf("리프레시 토큰이 발급되지 않았습니다. 동의 화면을 다시 거쳐야 할 수 있습니다: userId=%s", userId);
        }
        credentialStore.save(credential);
        return credential;
    }

    public void revoke(String userId) {
        if (credentialStore.delete(userId)) {
            log.infof("캘린더 연결을 해제했습니다: userId=%s", userId);
        }
    }

    static String refreshLeaseKey(String userId) {
        return "refresh:" + userId;
    }
}
