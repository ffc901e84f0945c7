package com.anonrelay.identity;

import com.anonrelay.shared.model.User;

import java.time.LocalDateTime;
import java.util.Optional;

public interface UserRepository {
    Optional<User> findByExternalId(long externalId);
    Optional<User> findById(long internalId);
    Optional<User> findByCode(String code);
    /**
     * Inserts a new user. Returns the stored row, or the existing one if another caller registered
     * the same external id first; empty when the public code is already taken by someone else.
     */
    Optional<User> insert(long externalId, String code, String displayName, LocalDateTime createdAt);
    void updateDisplayName(long internalId, String displayName);
}
