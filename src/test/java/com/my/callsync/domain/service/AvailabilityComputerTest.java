package com.my.callsync.domain.service;

import com.my.callsync.domain.exception.InvalidRequestException;
import com.my.callsync.domain.model.AvailabilityWindow;
import com.my.callsync.domain.model.BusyInterval;
import com.my.callsync.domain.model.FreeRange;
import com.my.callsync.domain.model.WorkHourPolicy;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AvailabilityComputerTest {

    private static final WorkHourPolicy ET = new WorkHourPolicy(9, 22, ZoneOffset.ofHours(-5), "ET");
    // 2026-02-06 is a Friday
    private static final LocalDate FRIDAY = LocalDate.of(2026, 2, 6);

    private final AvailabilityComputer computer = new AvailabilityComputer();

    @Test
    void busy_hour_splits_the_day() {
        // Monday 2/9 10:00-11:00 ET
        BusyInterval busy = new BusyInterval(Instant.parse("2026-02-09T15:00:00Z"), Instant.parse("2026-02-09T16:00:00Z"));

        List<AvailabilityWindow> windows = computer.computeWindows(List.of(busy), FRIDAY, ET, 1, 14);

        assertThat(windows).singleElement().satisfies(window -> {
            assertThat(window.day()).isEqualTo(LocalDate.of(2026, 2, 9));
            assertThat(window.freeRanges()).containsExactly(new FreeRange(9, 10), new FreeRange(11, 22));
            assertThat(window.fullyFree()).isFalse();
        });
        assertThat(computer.computeLines(List.of(busy), FRIDAY, ET, 1, 14))
                .containsExactly("Monday (2/9): 9am - 10am; 11am - 10pm ET");
    }

    @Test
    void free_week_skips_weekend_and_lists_full_days() {
        List<String> lines = computer.computeLines(List.of(), FRIDAY, ET, 5, 14);

        assertThat(lines).containsExactly(
                "Monday (2/9): 9am - 10pm ET",
                "Tuesday (2/10): 9am - 10pm ET",
                "Wednesday (2/11): 9am - 10pm ET",
                "Thursday (2/12): 9am - 10pm ET",
                "Friday (2/13): 9am - 10pm ET");
    }

    @Test
    void fully_booked_weekday_counts_but_has_no_line() {
        BusyInterval wholeMonday = new BusyInterval(Instant.parse("2026-02-09T13:00:00Z"), Instant.parse("2026-02-10T04:00:00Z"));

        List<String> lines = computer.computeLines(List.of(wholeMonday), FRIDAY, ET, 2, 14);

        assertThat(lines).containsExactly("Tuesday (2/10): 9am - 10pm ET");
    }

    @Test
    void partial_overlap_marks_the_whole_slot_busy() {
        // Monday 12:30-13:10 ET touches the 12pm and 1pm slots
        BusyInterval busy = new BusyInterval(Instant.parse("2026-02-09T17:30:00Z"), Instant.parse("2026-02-09T18:10:00Z"));

        List<String> lines = computer.computeLines(List.of(busy), FRIDAY, ET, 1, 14);

        assertThat(lines).containsExactly("Monday (2/9): 9am - 12pm; 2pm - 10pm ET");
    }

    @Test
    void back_to_back_boundary_does_not_block_next_slot() {
        BusyInterval busy = new BusyInterval(Instant.parse("2026-02-09T14:00:00Z"), Instant.parse("2026-02-09T15:00:00Z"));

        List<String> lines = computer.computeLines(List.of(busy), FRIDAY, ET, 1, 14);

        assertThat(lines).containsExactly("Monday (2/9): 10am - 10pm ET");
    }

    @Test
    void scan_stops_at_ceiling() {
        List<String> lines = computer.computeLines(List.of(), FRIDAY, ET, 5, 3);

        // 2/7 and 2/8 are the weekend, so only Monday fits in three days
        assertThat(lines).containsExactly("Monday (2/9): 9am - 10pm ET");
    }

    @Test
    void policy_in_another_offset() {
        WorkHourPolicy utc = new WorkHourPolicy(0, 12, ZoneOffset.UTC, "UTC");

        List<String> lines = computer.computeLines(List.of(), FRIDAY, utc, 1, 14);

        assertThat(lines).containsExactly("Monday (2/9): 12am - 12pm UTC");
    }

    @Test
    void rejects_invalid_policy_and_targets() {
        assertThatThrownBy(() -> new WorkHourPolicy(22, 9, ZoneOffset.UTC, "UTC"))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> computer.computeWindows(List.of(), FRIDAY, ET, 0, 14))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> computer.computeWindows(List.of(), FRIDAY, ET, 5, 0))
                .isInstanceOf(InvalidRequestException.class);
    }
}
