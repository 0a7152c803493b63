package com.venuepulse.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Categorical sentiment derived from a fused score.
 *
 * <p>{@link #fromScore(double)} is the only place the thresholds live; every component that
 * needs a label calls it so the label stays a pure function of the score.
 * <pre>
 *   score &gt;  0.1  → POSITIVE
 *   score &lt; -0.1  → NEGATIVE
 *   otherwise     → NEUTRAL
 * </pre>
 */
public enum SentimentLabel {
    POSITIVE,
    NEGATIVE,
    NEUTRAL;

    public static final double POSITIVE_THRESHOLD =  0.1;
    public static final double NEGATIVE_THRESHOLD = -0.1;

    public static SentimentLabel fromScore(double score) {
        if (score > POSITIVE_THRESHOLD) return POSITIVE;
        if (score < NEGATIVE_THRESHOLD) return NEGATIVE;
        return NEUTRAL;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
