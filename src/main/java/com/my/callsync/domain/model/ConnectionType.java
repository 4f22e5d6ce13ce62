package com.my.callsync.domain.model;

public enum ConnectionType {
    COLD,
    ALUMNI,
    FRIEND,
    REFERRAL
}
