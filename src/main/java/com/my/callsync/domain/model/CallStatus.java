package com.my.callsync.domain.model;

public enum CallStatus {
    SCHEDULED,
    COMPLETED,
    CANCELED
}
