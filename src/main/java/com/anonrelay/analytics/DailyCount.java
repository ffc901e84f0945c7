package com.anonrelay.analytics;

import java.time.LocalDate;

public record DailyCount(LocalDate date, long count) {}
