package com.anonrelay.shared.model;

import java.time.LocalDateTime;

public record RateLimitState(
    long userId,
    LocalDateTime windowStart,
    int messageCount,
    boolean blocked,
    LocalDateTime blockedUntil
) {
    public static RateLimitState fresh(long userId, LocalDateTime now) {
        return new RateLimitState(userId, now, 1, false, null);
    }

    public RateLimitState withCount(int count) {
        return new RateLimitState(userId, windowStart, count, blocked, blockedUntil);
    }

    public RateLimitState blockedUntil(LocalDateTime until) {
        return new RateLimitState(userId, windowStart, messageCount, true, until);
    }
}
