package com.my.callsync.domain.model;

import java.time.Instant;

/**
 * 동기화 패스 입력. 창은 {@code [timeMin, timeMax)}이며 검증은 {@code SyncEngine}에서 네트워크 호출 전에 수행한다.
 */
public record SyncRequest(String userId, String ownerEmail, Instant timeMin, Instant timeMax) {
}
