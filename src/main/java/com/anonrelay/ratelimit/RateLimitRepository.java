package com.anonrelay.ratelimit;

import com.anonrelay.shared.model.RateLimitState;

import java.time.LocalDateTime;
import java.util.Optional;

public interface RateLimitRepository {
    Optional<RateLimitState> find(long userId);
    /** @return false when a row for the user already exists */
    boolean insertIfAbsent(RateLimitState state);
    /** Keyed update of an existing row; @return false when no row exists */
    boolean update(RateLimitState state);
    /** Marks the user blocked, creating the row if needed. */
    void block(long userId, LocalDateTime until, LocalDateTime now);
    /** Clears any block and restarts the window. */
    void unblock(long userId, LocalDateTime now);
}
