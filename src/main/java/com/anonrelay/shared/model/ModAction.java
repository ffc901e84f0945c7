package com.anonrelay.shared.model;

import java.util.Locale;

public enum ModAction {
    APPROVE,
    REJECT,
    BLOCK,
    UNBLOCK,
    ANSWER_DM,
    ANSWER_CHANNEL;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ModAction fromCode(String code) {
        return valueOf(code.toUpperCase(Locale.ROOT));
    }
}
