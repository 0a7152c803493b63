package com.venuepulse.common.model;

import java.util.Map;
import java.util.function.Function;

/**
 * Result of one model adapter call: either a score or a typed failure.
 *
 * <p>Consumers go through {@link #fold(Function, Function)} so both cases are always handled.
 */
public sealed interface ModelOutcome permits ModelOutcome.Scored, ModelOutcome.Failed {

    String modelName();

    <R> R fold(Function<Scored, R> onScored, Function<Failed, R> onFailed);

    default boolean succeeded() {
        return fold(s -> true, f -> false);
    }

    static Scored sentiment(String modelName, double score, double confidence) {
        return new Scored(modelName, ModelRole.SENTIMENT, score, confidence, Map.of());
    }

    static Scored emotion(String modelName, double confidence, Map<String, Double> emotions) {
        return new Scored(modelName, ModelRole.EMOTION, 0.0, confidence, emotions);
    }

    static Failed failed(String modelName, FailureKind kind, String detail) {
        return new Failed(modelName, kind, detail);
    }

    record Scored(
        String modelName,
        ModelRole role,
        double score,
        double confidence,
        Map<String, Double> emotions
    ) implements ModelOutcome {

        public Scored {
            if (!Double.isFinite(score) || score < -1.0 || score > 1.0) {
                throw new IllegalArgumentException(modelName + " score out of range: " + score);
            }
            if (!Double.isFinite(confidence) || confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException(modelName + " confidence out of range: " + confidence);
            }
            emotions = emotions == null ? Map.of() : Map.copyOf(emotions);
            emotions.forEach((emotion, intensity) -> {
                if (!Double.isFinite(intensity) || intensity < 0.0 || intensity > 1.0) {
                    throw new IllegalArgumentException(modelName + " emotion out of range: " + emotion + "=" + intensity);
                }
            });
        }

        @Override
        public <R> R fold(Function<Scored, R> onScored, Function<Failed, R> onFailed) {
            return onScored.apply(this);
        }
    }

    record Failed(String modelName, FailureKind kind, String detail) implements ModelOutcome {

        @Override
        public <R> R fold(Function<Scored, R> onScored, Function<Failed, R> onFailed) {
            return onFailed.apply(this);
        }
    }
}
