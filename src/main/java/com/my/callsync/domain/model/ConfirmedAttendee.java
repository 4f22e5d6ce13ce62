package com.my.callsync.domain.model;

import java.util.Objects;

/**
 * 사용자가 승인한 보류 참석자와 사용자가 입력한 연락처 정보.
 */
public record ConfirmedAttendee(PendingAttendee pending, String name, String firm, String position,
                                ConnectionType connectionType) {
    public ConfirmedAttendee {
        Objects.requireNonNull(pending, "pending");
        name = name == null || name.isBlank() ? pending.displayName() : name.trim();
        connectionType = connectionType == null ? ConnectionType.COLD : connectionType;
    }

    public static ConfirmedAttendee of(PendingAttendee pending) {
        return new ConfirmedAttendee(pending, null, null, null, null);
    }

    public String email() {
        return pending.email();
    }
}
