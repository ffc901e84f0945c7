package com.anonrelay.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".anonrelay", "config.yaml"
    );

    public static AnonRelayConfig load() {
        return load(DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static AnonRelayConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var telegram = (Map<String, Object>) raw.getOrDefault("telegram", Map.of());
        var moderation = (Map<String, Object>) raw.getOrDefault("moderation", Map.of());
        var rateLimit = (Map<String, Object>) raw.getOrDefault("rate-limit", Map.of());
        var outbound = (Map<String, Object>) raw.getOrDefault("outbound", Map.of());
        var lexicon = (String) raw.get("lexicon");

        var operatorId = Long.parseLong(envOrDefault("ANONRELAY_ADMIN_ID",
            String.valueOf(moderation.getOrDefault("operator-id", 0))));

        return new AnonRelayConfig(
            envOrDefault("ANONRELAY_BOT_TOKEN",
                (String) telegram.getOrDefault("bot-token", "")),
            operatorId,
            envOrDefault("ANONRELAY_ADMIN_CHANNEL",
                String.valueOf(moderation.getOrDefault("admin-channel", operatorId))),
            envOrDefault("ANONRELAY_CHANNEL_ID",
                String.valueOf(moderation.getOrDefault("publish-channel", ""))),
            Boolean.parseBoolean(envOrDefault("ANONRELAY_MODERATION_ENABLED",
                String.valueOf(moderation.getOrDefault("enabled", true)))),
            Boolean.parseBoolean(String.valueOf(moderation.getOrDefault("direct-delivery", true))),
            (String) telegram.getOrDefault("bot-username", ""),
            parseRateLimit(rateLimit),
            Integer.parseInt(String.valueOf(outbound.getOrDefault("timeout", 10))),
            Integer.parseInt(String.valueOf(outbound.getOrDefault("worker-threads", 8))),
            lexicon != null && !lexicon.isBlank() ? Path.of(lexicon) : null
        );
    }

    private static RateLimitConfig parseRateLimit(Map<String, Object> rateLimit) {
        var defaults = RateLimitConfig.defaults();
        return new RateLimitConfig(
            Integer.parseInt(envOrDefault("ANONRELAY_RATE_LIMIT_MESSAGES",
                String.valueOf(rateLimit.getOrDefault("max-messages", defaults.maxMessages())))),
            Integer.parseInt(envOrDefault("ANONRELAY_RATE_LIMIT_WINDOW_MINUTES",
                String.valueOf(rateLimit.getOrDefault("window-minutes", defaults.windowMinutes())))),
            Integer.parseInt(envOrDefault("ANONRELAY_SPAM_THRESHOLD",
                String.valueOf(rateLimit.getOrDefault("spam-threshold", defaults.spamThreshold())))),
            Integer.parseInt(String.valueOf(rateLimit.getOrDefault("auto-block-hours", defaults.autoBlockHours())))
        );
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
