package com.my.callsync.domain.model;

import java.util.Locale;
import java.util.Objects;

/**
 * 왜: 연락처와 연결되지 않은 참석자를 사람의 확인 전까지 보류하기 위해 원본 이벤트 맥락과 함께 보관하기 위함.
 */
public record PendingAttendee(
        String email,
        String displayName,
        String externalEventId,
        String eventTitle,
        TimeRange timeRange,
        String location,
        String notes
) {
    public PendingAttendee {
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(externalEventId, "externalEventId");
        Objects.requireNonNull(timeRange, "timeRange");
        email = email.trim().toLowerCase(Locale.ROOT);
        if (email.isBlank()) {
            throw new IllegalArgumentException("참석자 이메일은 비어 있을 수 없습니다.");
        }
        if (displayName == null || displayName.isBlank()) {
            int at = email.indexOf('@');
            displayName = at > 0 ? email.substring(0, at) : email;
        }
        eventTitle = eventTitle == null || eventTitle.isBlank() ? ExternalEvent.UNTITLED : eventTitle;
    }

    public static PendingAttendee from(ExternalAttendee attendee, ExternalEvent event) {
        return new PendingAttendee(
                attendee.normalizedEmail(),
                attendee.displayName(),
                event.id(),
                event.title(),
                event.timeRange(),
                event.location(),
                event.description()
        );
    }
}
