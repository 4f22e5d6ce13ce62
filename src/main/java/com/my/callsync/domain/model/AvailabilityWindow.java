package com.my.callsync.domain.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 왜: 하루의 빈 시간대를 순수 데이터로 표현해 문구 생성기가 날짜를 직접 만들지 않고 그대로 끼워 넣도록 하기 위함.
 */
public record AvailabilityWindow(LocalDate day, List<FreeRange> freeRanges, boolean fullyFree) {

    public AvailabilityWindow {
        Objects.requireNonNull(day, "day");
        freeRanges = freeRanges == null ? List.of() : List.copyOf(freeRanges);
    }

    public String dayLabel() {
        DayOfWeek dayOfWeek = day.getDayOfWeek();
        return dayOfWeek.getDisplayName(TextStyle.FULL, Locale.ENGLISH)
                + " (" + day.getMonthValue() + "/" + day.getDayOfMonth() + ")";
    }

    /**
     * {@code "Monday (2/9): 9am - 10am; 11am - 10pm ET"} 형태로 렌더링한다.
     */
    public String format(String zoneLabel) {
        String ranges = freeRanges.stream()
                .map(range -> formatHour(range.startHour()) + " - " + formatHour(range.endHour()))
                .collect(Collectors.joining("; "));
        String suffix = zoneLabel == null || zoneLabel.isBlank() ? "" : " " + zoneLabel;
        return dayLabel() + ": " + ranges + suffix;
    }

    static String formatHour(int hour) {
        if (hour == 0 || hour == 24) {
            return "12am";
        }
        if (hour == 12) {
            return "12pm";
        }
        return hour < 12 ? hour + "am" : (hour - 12) + "pm";
    }
}
