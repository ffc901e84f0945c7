package com.anonrelay.shared.model;

public enum Sentiment {
    POSITIVE,
    NEUTRAL,
    NEGATIVE
}
