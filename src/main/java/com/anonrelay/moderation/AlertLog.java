package com.anonrelay.moderation;

import com.anonrelay.channels.OutboundChannel;
import com.anonrelay.observability.RelayMetrics;
import com.anonrelay.shared.model.Alert;
import com.anonrelay.shared.model.AlertType;
import com.anonrelay.shared.model.ModAction;
import com.anonrelay.shared.model.ModLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Append-only alert and audit sink. Writes run on the supplied executor and never throw back to
 * the caller: a failed write is logged and dropped.
 */
public class AlertLog {

    private static final Logger log = LoggerFactory.getLogger(AlertLog.class);

    private final AlertRepository alerts;
    private final ModLogRepository modLog;
    private final OutboundChannel channel;
    private final String adminChannel;
    private final Clock clock;
    private final Executor writer;
    private final RelayMetrics metrics;

    public AlertLog(AlertRepository alerts, ModLogRepository modLog, OutboundChannel channel,
                    String adminChannel, Clock clock, Executor writer, RelayMetrics metrics) {
        this.alerts = alerts;
        this.modLog = modLog;
        this.channel = channel;
        this.adminChannel = adminChannel;
        this.clock = clock;
        this.writer = writer;
        this.metrics = metrics;
    }

    /** Persists the alert and pings the admin channel. */
    public void raise(AlertType type, Long userId, String details) {
        var now = LocalDateTime.now(clock);
        metrics.alerts(type.code()).increment();
        dispatch("alert " + type.code(), () -> {
            alerts.insert(type, userId, details, now);
            log.info("Alert {} raised for user {}", type.code(), userId);
        });
        dispatch("admin notice for " + type.code(), () -> channel.notify(adminChannel, adminNotice(type, userId, details)));
    }

    public boolean resolve(long alertId) {
        return alerts.resolve(alertId);
    }

    public List<Alert> unresolved() {
        return alerts.findUnresolved();
    }

    public void logModAction(long moderatorId, ModAction action, Long messageId, Long targetUserId, String details) {
        var now = LocalDateTime.now(clock);
        dispatch("mod log " + action.code(),
                () -> modLog.insert(moderatorId, action, messageId, targetUserId, details, now));
    }

    public List<ModLogEntry> recent(int limit) {
        return modLog.findRecent(limit);
    }

    private void dispatch(String what, Runnable write) {
        try {
            writer.execute(() -> {
                try {
                    write.run();
                } catch (RuntimeException e) {
                    log.error("Failed to write {}", what, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Dropped {}: writer unavailable", what, e);
        }
    }

    static String adminNotice(AlertType type, Long userId, String details) {
        var who = userId != null ? "user " + userId : "unknown user";
        return switch (type) {
            case URGENT -> "🔥 URGENT message from " + who + "\n\n" + nullToEmpty(details);
            case NEAR_SPAM -> "⚠️ Suspicious activity: " + who + " hit the rate limit (" + nullToEmpty(details) + ")";
            case AUTO_BLOCK -> "🚫 Auto-block: " + who + " (" + nullToEmpty(details) + ")";
        };
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
