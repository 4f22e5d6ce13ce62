package com.my.callsync.domain.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AvailabilityWindowTest {

    @Test
    void formats_hours_on_twelve_hour_clock() {
        assertThat(AvailabilityWindow.formatHour(0)).isEqualTo("12am");
        assertThat(AvailabilityWindow.formatHour(9)).isEqualTo("9am");
        assertThat(AvailabilityWindow.formatHour(12)).isEqualTo("12pm");
        assertThat(AvailabilityWindow.formatHour(13)).isEqualTo("1pm");
        assertThat(AvailabilityWindow.formatHour(24)).isEqualTo("12am");
    }

    @Test
    void formats_day_line() {
        AvailabilityWindow window = new AvailabilityWindow(LocalDate.of(2026, 3, 2),
                List.of(new FreeRange(9, 10), new FreeRange(13, 17)), false);

        assertThat(window.format("ET")).isEqualTo("Monday (3/2): 9am - 10am; 1pm - 5pm ET");
    }
}
