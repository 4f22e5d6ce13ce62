package com.my.callsync.domain.model;

import java.util.Locale;

public record ExternalAttendee(String email, String displayName, boolean self) {

    public String normalizedEmail() {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }
}
