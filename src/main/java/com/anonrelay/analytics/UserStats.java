package com.anonrelay.analytics;

/** Approved messages only. */
public record UserStats(long received, long sent) {}
