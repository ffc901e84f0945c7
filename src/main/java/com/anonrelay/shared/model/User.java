package com.anonrelay.shared.model;

import java.time.LocalDateTime;

public record User(
    long internalId,
    long externalId,
    String publicCode,
    String displayName,
    boolean active,
    LocalDateTime createdAt
) {
    public User withDisplayName(String name) {
        return new User(internalId, externalId, publicCode, name, active, createdAt);
    }
}
