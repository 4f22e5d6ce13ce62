package com.my.callsync.domain.model;

import java.util.Objects;

/**
 * 왜: 내부 통화 기록 원장을 표현하며, (사용자, 공급자, 외부 이벤트 ID) 조합을 중복 미러링 방지 키로 사용하기 위함.
 */
public record LocalCallRecord(
        String id,
        String userId,
        String contactId,
        String title,
        TimeRange timeRange,
        String location,
        String notes,
        CallStatus status,
        String externalProvider,
        String externalEventId
) {
    public LocalCallRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(timeRange, "timeRange");
        status = status == null ? CallStatus.SCHEDULED : status;
        if (title.isBlank()) {
            throw new IllegalArgumentException("통화 제목은 비어 있을 수 없습니다.");
        }
    }

    public boolean hasExternalEvent() {
        return externalEventId != null && !externalEventId.isBlank();
    }

    public LocalCallRecord withExternalEvent(String provider, String eventId) {
        return new LocalCallRecord(id, userId, contactId, title, timeRange, location, notes, status, provider, eventId);
    }

    public LocalCallRecord withoutExternalEvent() {
        return new LocalCallRecord(id, userId, contactId, title, timeRange, location, notes, status, null, null);
    }
}
