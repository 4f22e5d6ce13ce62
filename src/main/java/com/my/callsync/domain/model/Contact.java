package com.my.callsync.domain.model;

import java.util.Objects;

public record Contact(String id, String userId, String name, String email, String firm, String position, ContactStage stage) {
    public Contact {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(name, "name");
        stage = stage == null ? ContactStage.RESEARCHING : stage;
    }

    /**
     * 외부 이벤트 설명에 붙는 연락처 한 줄. 예: {@code Contact: Alice (Acme)}
     */
    public String identityLine() {
        return "Contact: " + name + (firm == null || firm.isBlank() ? "" : " (" + firm + ")");
    }
}
