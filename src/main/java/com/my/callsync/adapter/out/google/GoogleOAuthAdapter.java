package com.my.callsync.adapter.out.google;

import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeRequestUrl;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeTokenRequest;
import com.google.api.client.googleapis.auth.oauth2.GoogleRefreshTokenRequest;
import com.google.api.client.googleapis.auth.oauth2.GoogleTokenResponse;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.my.callsync.config.AppConfig;
import com.my.callsync.domain.exception.ProviderException;
import com.my.callsync.domain.model.TokenGrant;
import com.my.callsync.domain.port.out.OAuthTokenPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.List;

/**
 * 왜: 구글 OAuth 토큰 엔드포인트(인가 코드 교환, 리프레시 토큰 그랜트)를 도메인 포트로 감싸 토큰 저장 정책과 분리하기 위함.
 */
@ApplicationScoped
public class GoogleOAuthAdapter implements OAuthTokenPort {

    private static final Logger log = Logger.getLogger(GoogleOAuthAdapter.class);

    static final List<String> SCOPES = List.of(
            "https://www.googleapis.com/auth/calendar.events",
            "https://www.googleapis.com/auth/calendar.readonly"
    );

    private final HttpTransport httpTransport;
    private final JsonFactory jsonFactory;
    private final String clientId;
    private final String clientSecret;
    private final String redirectUri;

    @Inject
    public GoogleOAuthAdapter(AppConfig appConfig) {
        this(GoogleTransports.trustedTransport(),
                GoogleTransports.jsonFactory(),
                appConfig.google().clientId().orElse(""),
                appConfig.google().clientSecret().orElse(""),
                appConfig.google().redirectUri());
    }

    GoogleOAuthAdapter(HttpTransport httpTransport, JsonFactory jsonFactory,
                       String clientId, String clientSecret, String redirectUri) {
        this.httpTransport = httpTransport;
        this.jsonFactory = jsonFactory;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.redirectUri = redirectUri;
    }

    @Override
    public String authorizationUrl(String state) {
        requireClient();
        return new GoogleAuthorizationCodeRequestUrl(clientId, redirectUri, SCOPES)
                .setAccessType("offline")
                .setState(state)
                .set("prompt", "consent")
                .build();
    }

    @Override
    public TokenGrant exchangeCode(String authorizationCode) {
        requireClient();
        try {
            GoogleTokenResponse response = new GoogleAuthorizationCodeTokenRequest(
                    httpTransport, jsonFactory, clientId, clientSecret, authorizationCode, redirectUri)
                    .execute();
            if (response.getRefreshToken() == null) {
                log.warn("인가 코드 교환 응답에 refresh_token이 없습니다. prompt=consent로 다시 인증해야 할 수 있습니다.");
            }
            return toGrant(response);
        } catch (HttpResponseException e) {
            throw new ProviderException(e.getStatusCode(), "구글 인가 코드 교환 실패 (status=" + e.getStatusCode() + ")", e);
        } catch (IOException e) {
            throw new ProviderException(ProviderException.TRANSPORT_FAILURE, "구글 인가 코드 교환 중 전송 실패", e);
        }
    }

    @Override
    public TokenGrant refresh(String refreshToken) {
        requireClient();
        try {
            GoogleTokenResponse response = new GoogleRefreshTokenRequest(
                    httpTransport, jsonFactory, refreshToken, clientId, clientSecret)
                    .execute();
            return toGrant(response);
        } catch (HttpResponseException e) {
            throw new ProviderException(e.getStatusCode(), "구글 토큰 갱신 실패 (status=" + e.getStatusCode() + ")", e);
        } catch (IOException e) {
            throw new ProviderException(ProviderException.TRANSPORT_FAILURE, "구글 토큰 갱신 중 전송 실패", e);
        }
    }

    private TokenGrant toGrant(GoogleTokenResponse response) {
        Long expiresIn = response.getExpiresInSeconds();
        return new TokenGrant(
                response.getAccessToken(),
                response.getRefreshToken(),
                expiresIn == null ? TokenGrant.DEFAULT_EXPIRES_IN_SECONDS : expiresIn
        );
    }

    private void requireClient() {
        if (clientId.isBlank() || clientSecret.isBlank()) {
            throw new IllegalStateException("구글 OAuth 클라이언트 설정이 필요합니다: app.google.client-id, app.google.client-secret");
        }
    }
}
