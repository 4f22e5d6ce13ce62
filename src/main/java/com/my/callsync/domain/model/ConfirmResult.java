package com.my.callsync.domain.model;

import java.util.List;

public record ConfirmResult(int created, List<PendingAttendee> unresolved) {
    public ConfirmResult {
        unresolved = unresolved == null ? List.of() : List.copyOf(unresolved);
    }
}
