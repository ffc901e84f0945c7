package com.anonrelay.shared.model;

import java.util.Locale;

public enum AlertType {
    URGENT,
    NEAR_SPAM,
    AUTO_BLOCK;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AlertType fromCode(String code) {
        return valueOf(code.toUpperCase(Locale.ROOT));
    }
}
