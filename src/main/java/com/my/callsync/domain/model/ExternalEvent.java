package com.my.callsync.domain.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 왜: 공급자 소유의 읽기 전용 이벤트를 도메인 형태로 고정해 동기화/가용성 계산이 SDK 모델에 의존하지 않게 하기 위함.
 * <p>
 * 종일 이벤트는 날짜의 UTC 자정을 시작으로 담고 {@code allDay}로 표시한다. 구체적인 시각이 없으므로 바쁜 구간으로 쓰지 않는다.
 */
public record ExternalEvent(
        String id,
        String title,
        TimeRange timeRange,
        boolean allDay,
        String location,
        String description,
        List<ExternalAttendee> attendees,
        EventStatus status
) {
    public static final String UNTITLED = "(No title)";

    public ExternalEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timeRange, "timeRange");
        title = title == null || title.isBlank() ? UNTITLED : title;
        attendees = attendees == null ? List.of() : List.copyOf(attendees);
        status = status == null ? EventStatus.CONFIRMED : status;
    }

    public boolean isCancelled() {
        return status == EventStatus.CANCELLED;
    }

    public boolean hasConcreteTimes() {
        return !allDay;
    }

    /**
     * 계정 소유자를 제외한 참석자. self 플래그 또는 소유자 이메일(대소문자 무시)로 소유자를 판별한다.
     */
    public List<ExternalAttendee> guests(String ownerEmail) {
        String owner = ownerEmail == null ? null : ownerEmail.trim().toLowerCase(Locale.ROOT);
        return attendees.stream()
                .filter(attendee -> !attendee.self())
                .filter(attendee -> owner == null || !owner.equals(attendee.normalizedEmail()))
                .toList();
    }
}
