package com.my.callsync.adapter.out.google;

import com.google.api.client.json.jackson2.JacksonFactory;
import com.my.callsync.domain.exception.ProviderException;
import com.my.callsync.domain.model.TokenGrant;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GoogleOAuthAdapterTest {

    private static final String REDIRECT = "http://localhost:8080/gcal/oauth-callback";

    @Test
    void authorization_url_requests_offline_access_with_consent() {
        GoogleOAuthAdapter adapter = adapter(RecordingTransport.respond(200, "{}"), "client-1");

        String url = adapter.authorizationUrl("user-1");

        assertThat(url)
                .startsWith("https://accounts.google.com/")
                .contains("client_id=client-1")
                .contains("access_type=offline")
                .contains("prompt=consent")
                .contains("state=user-1")
                .contains("calendar.events");
    }

    @Test
    void exchange_maps_token_response() {
        RecordingTransport transport = RecordingTransport.respond(200,
                "{\"access_token\":\"access-1\",\"refresh_token\":\"refresh-1\",\"expires_in\":3599,\"token_type\":\"Bearer\"}");
        GoogleOAuthAdapter adapter = adapter(transport, "client-1");

        TokenGrant grant = adapter.exchangeCode("code-1");

        assertThat(grant.accessToken()).isEqualTo("access-1");
        assertThat(grant.refreshToken()).isEqualTo("refresh-1");
        assertThat(grant.expiresInSeconds()).isEqualTo(3599);
        assertThat(transport.methods).containsExactly("POST");
    }

    @Test
    void refresh_without_expiry_uses_default() {
        GoogleOAuthAdapter adapter = adapter(RecordingTransport.respond(200,
                "{\"access_token\":\"access-2\",\"token_type\":\"Bearer\"}"), "client-1");

        TokenGrant grant = adapter.refresh("refresh-1");

        assertThat(grant.refreshToken()).isNull();
        assertThat(grant.expiresInSeconds()).isEqualTo(TokenGrant.DEFAULT_EXPIRES_IN_SECONDS);
    }

    @Test
    void rejected_grant_keeps_status() {
        GoogleOAuthAdapter adapter = adapter(RecordingTransport.respond(400, "{\"error\":\"invalid_grant\"}"), "client-1");

        assertThatThrownBy(() -> adapter.refresh("revoked"))
                .isInstanceOfSatisfying(ProviderException.class, e -> assertThat(e.status()).isEqualTo(400));
    }

    @Test
    void transport_failure_has_no_status() {
        GoogleOAuthAdapter adapter = adapter(RecordingTransport.failing(), "client-1");

        assertThatThrownBy(() -> adapter.exchangeCode("code-1"))
                .isInstanceOfSatisfying(ProviderException.class,
                        e -> assertThat(e.status()).isEqualTo(ProviderException.TRANSPORT_FAILURE));
    }

    @Test
    void missing_client_configuration_fails_fast() {
        GoogleOAuthAdapter adapter = adapter(RecordingTransport.respond(200, "{}"), "");

        assertThatThrownBy(() -> adapter.authorizationUrl("user-1"))
                .isInstanceOf(IllegalStateException.class);
    }

    private GoogleOAuthAdapter adapter(RecordingTransport transport, String clientId) {
        return new GoogleOAuthAdapter(transport, JacksonFactory.getDefaultInstance(), clientId, "secret", REDIRECT);
    }
}
