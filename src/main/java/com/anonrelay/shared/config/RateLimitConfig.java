package com.anonrelay.shared.config;

public record RateLimitConfig(int maxMessages, int windowMinutes, int spamThreshold, int autoBlockHours) {

    public RateLimitConfig {
        if (maxMessages < 1) throw new IllegalArgumentException("max-messages must be positive");
        if (windowMinutes < 1) throw new IllegalArgumentException("window-minutes must be positive");
        if (spamThreshold < 1) throw new IllegalArgumentException("spam-threshold must be positive");
        if (autoBlockHours < 1) throw new IllegalArgumentException("auto-block-hours must be positive");
    }

    public static RateLimitConfig defaults() {
        return new RateLimitConfig(10, 60, 20, 24);
    }
}
