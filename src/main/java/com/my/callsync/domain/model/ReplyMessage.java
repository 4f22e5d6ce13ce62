package com.my.callsync.domain.model;

import java.util.Objects;

/**
 * 왜: 명령 처리 결과의 계약을 고정하여 어댑터가 일관된 포맷으로 전송하도록 하기 위함.
 */
public record ReplyMessage(String replyToUserId, String commandId, String status, Object payload) {
    public ReplyMessage {
        Objects.requireNonNull(replyToUserId, "replyToUserId");
        Objects.requireNonNull(status, "status");
        if (replyToUserId.isBlank()) {
            throw new IllegalArgumentException("replyToUserId는 비어 있을 수 없습니다.");
        }
    }
}
