package com.venuepulse.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Fused sentiment for a single mention.
 *
 * <p>{@code score} is in [-1, 1], {@code confidence} in [0, 1]. The label is never passed in;
 * it is derived through {@link SentimentLabel#fromScore(double)}.
 */
public record SentimentResult(
    @JsonProperty("score")            double score,
    @JsonProperty("confidence")       double confidence,
    @JsonProperty("label")            SentimentLabel label,
    @JsonProperty("per_model_scores") Map<String, Double> perModelScores
) {
    public SentimentResult {
        if (!Double.isFinite(score) || score < -1.0 || score > 1.0) {
            throw new IllegalArgumentException("score out of range: " + score);
        }
        if (!Double.isFinite(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
        perModelScores = perModelScores == null ? Map.of() : Map.copyOf(perModelScores);
    }

    public static SentimentResult of(double score, double confidence, Map<String, Double> perModelScores) {
        return new SentimentResult(score, confidence, SentimentLabel.fromScore(score), perModelScores);
    }
}
