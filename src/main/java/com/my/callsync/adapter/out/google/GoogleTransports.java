package com.my.callsync.adapter.out.google;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;

import java.io.IOException;
import java.security.GeneralSecurityException;

final class GoogleTransports {

    static final int CONNECT_TIMEOUT_MILLIS = 10_000;
    static final int READ_TIMEOUT_MILLIS = 20_000;

    private GoogleTransports() {
    }

    static HttpTransport trustedTransport() {
        try {
            return GoogleNetHttpTransport.newTrustedTransport();
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("구글 HTTP 전송 초기화 실패", e);
        }
    }

    static JsonFactory jsonFactory() {
        return JacksonFactory.getDefaultInstance();
    }
}
