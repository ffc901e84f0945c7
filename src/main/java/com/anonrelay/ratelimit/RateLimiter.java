package com.anonrelay.ratelimit;

import com.anonrelay.moderation.AlertLog;
import com.anonrelay.observability.RelayMetrics;
import com.anonrelay.shared.config.RateLimitConfig;
import com.anonrelay.shared.model.AlertType;
import com.anonrelay.shared.model.RateLimitState;
import com.anonrelay.shared.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Per-user fixed-window limiter with a three step escalation: allow, deny with an early warning to
 * moderators, then an automatic temporary block once the attempt count reaches the spam threshold.
 *
 * <p>Denied attempts still count toward the window so that a flood eventually crosses the spam
 * threshold. The state of one user is only ever read and written under that user's lock; alerts
 * are raised after the lock is released.</p>
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);
    private static final int NEAR_SPAM_MARGIN = 5;

    private final RateLimitRepository repository;
    private final RateLimitConfig config;
    private final long operatorExternalId;
    private final AlertLog alerts;
    private final Clock clock;
    private final RelayMetrics metrics;
    private final KeyedLocks locks = new KeyedLocks(64);

    public RateLimiter(RateLimitRepository repository, RateLimitConfig config, long operatorExternalId,
                       AlertLog alerts, Clock clock, RelayMetrics metrics) {
        this.repository = repository;
        this.config = config;
        this.operatorExternalId = operatorExternalId;
        this.alerts = alerts;
        this.clock = clock;
        this.metrics = metrics;
    }

    public RateDecision check(User sender) {
        if (sender.externalId() == operatorExternalId) {
            return new RateDecision.Allowed(0);
        }
        var userId = sender.internalId();
        var decision = locks.withLock(userId, () -> evaluate(userId, LocalDateTime.now(clock)));

        if (decision instanceof RateDecision.AutoBlocked blocked) {
            metrics.autoBlocks().increment();
            log.warn("Auto-blocked user {} after {} messages", userId, blocked.count());
            alerts.raise(AlertType.AUTO_BLOCK, userId,
                    "Auto-blocked for spam: " + blocked.count() + " msgs until " + blocked.until());
        } else if (decision instanceof RateDecision.RateLimited limited) {
            metrics.rateLimited().increment();
            if (limited.count() >= config.spamThreshold() - NEAR_SPAM_MARGIN) {
                alerts.raise(AlertType.NEAR_SPAM, userId, "Rate limit hit: " + limited.count() + " msgs");
            }
        }
        return decision;
    }

    public void block(long userId, int hours) {
        var now = LocalDateTime.now(clock);
        locks.withLock(userId, () -> {
            repository.block(userId, now.plusHours(hours), now);
            return null;
        });
        log.info("Blocked user {} for {}h", userId, hours);
    }

    public void unblock(long userId) {
        var now = LocalDateTime.now(clock);
        locks.withLock(userId, () -> {
            repository.unblock(userId, now);
            return null;
        });
        log.info("Unblocked user {}", userId);
    }

    private RateDecision evaluate(long userId, LocalDateTime now) {
        var existing = repository.find(userId);
        if (existing.isEmpty()) {
            if (repository.insertIfAbsent(RateLimitState.fresh(userId, now))) {
                return new RateDecision.Allowed(1);
            }
            existing = repository.find(userId);
            if (existing.isEmpty()) {
                throw new IllegalStateException("Rate limit row missing after conflicting insert: " + userId);
            }
        }
        var state = existing.get();

        if (state.blocked() && state.blockedUntil() != null) {
            if (now.isBefore(state.blockedUntil())) {
                return new RateDecision.Blocked(state.blockedUntil());
            }
            repository.update(RateLimitState.fresh(userId, now));
            return new RateDecision.Allowed(1);
        }

        var window = Duration.ofMinutes(config.windowMinutes());
        if (Duration.between(state.windowStart(), now).compareTo(window) > 0) {
            repository.update(RateLimitState.fresh(userId, now));
            return new RateDecision.Allowed(1);
        }

        int tentative = state.messageCount() + 1;
        if (tentative >= config.spamThreshold()) {
            var until = now.plusHours(config.autoBlockHours());
            repository.update(state.withCount(tentative).blockedUntil(until));
            return new RateDecision.AutoBlocked(tentative, until);
        }
        repository.update(state.withCount(tentative));
        if (tentative > config.maxMessages()) {
            return new RateDecision.RateLimited(tentative, config.maxMessages());
        }
        return new RateDecision.Allowed(tentative);
    }
}
