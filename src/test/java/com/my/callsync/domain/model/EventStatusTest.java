package com.my.callsync.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class EventStatusTest {

    @Test
    void provider_status_is_matched_independent_of_default_locale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(EventStatus.fromProvider("CANCELLED")).isEqualTo(EventStatus.CANCELLED);
            assertThat(EventStatus.fromProvider("TENTATIVE")).isEqualTo(EventStatus.TENTATIVE);
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void missing_or_unknown_status_is_confirmed() {
        assertThat(EventStatus.fromProvider(null)).isEqualTo(EventStatus.CONFIRMED);
        assertThat(EventStatus.fromProvider("confirmed")).isEqualTo(EventStatus.CONFIRMED);
        assertThat(EventStatus.fromProvider("whatever")).isEqualTo(EventStatus.CONFIRMED);
    }
}
