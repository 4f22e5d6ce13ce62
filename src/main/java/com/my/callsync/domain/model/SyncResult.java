package com.my.callsync.domain.model;

import java.util.List;

public record SyncResult(int synced, int skipped, List<PendingAttendee> pending) {
    public SyncResult {
        pending = pending == null ? List.of() : List.copyOf(pending);
    }
}
