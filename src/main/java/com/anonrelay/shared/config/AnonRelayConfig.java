package com.anonrelay.shared.config;

import java.nio.file.Path;

public record AnonRelayConfig(
    String telegramBotToken,
    long operatorId,
    String adminChannel,
    String publishChannel,
    boolean moderationEnabled,
    boolean directDelivery,
    String botUsername,
    RateLimitConfig rateLimit,
    int outboundTimeoutSeconds,
    int workerThreads,
    Path lexiconPath
) {
    public boolean hasPublishChannel() {
        return publishChannel != null && !publishChannel.isBlank();
    }
}
