package com.anonrelay.identity;

import com.anonrelay.shared.error.NotFoundException;
import com.anonrelay.shared.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps platform identities to internal users, each with a public code that can be shared as a link.
 */
public class IdentityRegistry {

    private static final Logger log = LoggerFactory.getLogger(IdentityRegistry.class);
    private static final String ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    static final int CODE_LENGTH = 8;
    static final int MAX_ATTEMPTS = 10;

    private final UserRepository users;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public IdentityRegistry(UserRepository users, Clock clock) {
        this.users = users;
        this.clock = clock;
    }

    public User getOrCreate(long externalId, String displayName) {
        var existing = users.findByExternalId(externalId);
        if (existing.isPresent()) {
            var user = existing.get();
            if (displayName != null && !Objects.equals(user.displayName(), displayName)) {
                users.updateDisplayName(user.internalId(), displayName);
                return user.withDisplayName(displayName);
            }
            return user;
        }

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            var created = users.insert(externalId, generateCode(), displayName, LocalDateTime.now(clock));
            if (created.isPresent()) {
                log.info("Registered user {} with code {}", created.get().internalId(), created.get().publicCode());
                return created.get();
            }
            log.debug("Public code collision for external id {} on attempt {}", externalId, attempt);
        }
        throw new IllegalStateException("Could not allocate a public code for external id " + externalId);
    }

    public Optional<User> lookupByCode(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        return users.findByCode(code);
    }

    public Optional<User> findById(long internalId) {
        return users.findById(internalId);
    }

    public User requireById(long internalId) {
        return users.findById(internalId).orElseThrow(() -> new NotFoundException("User", internalId));
    }

    String generateCode() {
        var sb = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
