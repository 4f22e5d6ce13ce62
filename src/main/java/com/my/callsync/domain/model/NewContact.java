package com.my.callsync.domain.model;

import java.util.Locale;
import java.util.Objects;

public record NewContact(String name, String email, String firm, String position,
                         ConnectionType connectionType, ContactStage stage) {
    public NewContact {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(email, "email");
        email = email.trim().toLowerCase(Locale.ROOT);
        connectionType = connectionType == null ? ConnectionType.COLD : connectionType;
        stage = stage == null ? ContactStage.RESEARCHING : stage;
    }
}
