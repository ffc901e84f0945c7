package com.anonrelay.tokens;

/**
 * Payload carried by a start link: a user's public code, or {@code r_} followed by a reply token.
 */
public sealed interface DeepLink permits DeepLink.ToUser, DeepLink.Reply, DeepLink.Unrecognized {

    String REPLY_PREFIX = "r_";

    record ToUser(String code) implements DeepLink {}

    record Reply(String token) implements DeepLink {}

    record Unrecognized(String raw) implements DeepLink {}

    static DeepLink parse(String payload) {
        if (payload == null || payload.isBlank()) return new Unrecognized(payload);
        var trimmed = payload.trim();
        if (trimmed.startsWith(REPLY_PREFIX)) {
            var token = trimmed.substring(REPLY_PREFIX.length());
            return token.isEmpty() ? new Unrecognized(trimmed) : new Reply(token);
        }
        return trimmed.chars().allMatch(Character::isLetterOrDigit)
                ? new ToUser(trimmed)
                : new Unrecognized(trimmed);
    }

    static String replyPayload(String token) {
        return REPLY_PREFIX + token;
    }

    static String startUrl(String botUsername, String payload) {
        return "https://t.me/" + botUsername + "?start=" + payload;
    }
}
