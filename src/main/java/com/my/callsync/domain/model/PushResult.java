package com.my.callsync.domain.model;

/**
 * @param action          실제로 수행된 동작 (create 요청이 update로 전환된 경우 UPDATE)
 * @param externalEventId 처리 후 기록에 남은 외부 이벤트 ID, 삭제 후에는 null
 */
public record PushResult(PushAction action, String externalEventId) {
}
