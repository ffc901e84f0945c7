package com.anonrelay.ratelimit;

import java.time.LocalDateTime;

/**
 * Outcome of a rate-limit check. Only {@link Allowed} lets the message through.
 */
public sealed interface RateDecision
        permits RateDecision.Allowed, RateDecision.RateLimited, RateDecision.Blocked, RateDecision.AutoBlocked {

    default boolean allowed() {
        return this instanceof Allowed;
    }

    record Allowed(int count) implements RateDecision {}

    record RateLimited(int count, int limit) implements RateDecision {}

    record Blocked(LocalDateTime until) implements RateDecision {}

    record AutoBlocked(int count, LocalDateTime until) implements RateDecision {}
}
