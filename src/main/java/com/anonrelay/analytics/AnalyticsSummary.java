package com.anonrelay.analytics;

import com.anonrelay.shared.model.Sentiment;

import java.util.Map;

/**
 * Dashboard snapshot. {@code peakHour} is null when no message has been stored yet.
 */
public record AnalyticsSummary(
    long total,
    long today,
    long week,
    long pending,
    long urgentPending,
    Map<Sentiment, Long> sentiments,
    Integer peakHour
) {
    public AnalyticsSummary {
        sentiments = Map.copyOf(sentiments);
    }
}
