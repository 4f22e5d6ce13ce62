package com.my.callsync.domain.model;

import java.util.Objects;

/**
 * 통화 기록 변경을 외부 캘린더로 전파하는 요청. 참석자 알림은 호출자가 명시적으로 요청할 때만 보낸다.
 */
public record PushRequest(String userId, String callRecordId, PushAction action,
                          String attendeeEmail, boolean notifyAttendees) {
    public PushRequest {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(callRecordId, "callRecordId");
        Objects.requireNonNull(action, "action");
        attendeeEmail = attendeeEmail == null || attendeeEmail.isBlank() ? null : attendeeEmail.trim();
    }
}
