package com.anonrelay.sentiment;

import com.anonrelay.shared.model.Sentiment;

public record SentimentResult(
    Sentiment sentiment,
    double score,
    boolean urgent,
    int posCount,
    int negCount
) {
    public static final SentimentResult EMPTY = new SentimentResult(Sentiment.NEUTRAL, 0.0, false, 0, 0);
}
