package com.anonrelay.shared.model;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Stored timestamps are ISO-8601 local date-times at second precision, so string order is time order.
 */
public final class Timestamps {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private Timestamps() {}

    public static String format(LocalDateTime time) {
        return time == null ? null : time.format(FORMAT);
    }

    public static LocalDateTime parse(String value) {
        return value == null ? null : LocalDateTime.parse(value);
    }
}
