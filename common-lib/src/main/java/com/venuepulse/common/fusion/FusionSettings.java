package com.venuepulse.common.fusion;

import java.util.Map;

/**
 * Fixed configuration table for {@link ConfidenceWeightedFusionStrategy}.
 *
 * <ul>
 *   <li>{@code reliabilityWeights}: per-model weight used for the confidence blend</li>
 *   <li>{@code defaultReliability}: weight for a model missing from the table</li>
 *   <li>{@code singleModelConfidenceCap}: ceiling on confidence when only one model survived</li>
 *   <li>{@code highConfidenceThreshold}: level from which a result counts as high-confidence;
 *       the single-model cap must sit strictly below it</li>
 *   <li>{@code maxVariance}: variance that maps to a full agreement penalty
 *       (1.0 is the largest population variance possible for scores in [-1, 1])</li>
 * </ul>
 */
public record FusionSettings(
    Map<String, Double> reliabilityWeights,
    double defaultReliability,
    double singleModelConfidenceCap,
    double highConfidenceThreshold,
    double maxVariance
) {
    public static final String LEXICON     = "lexicon";
    public static final String HOSPITALITY = "hospitality";
    public static final String TRANSFORMER = "transformer";

    public FusionSettings {
        reliabilityWeights = Map.copyOf(reliabilityWeights);
        reliabilityWeights.forEach((model, weight) -> {
            if (weight <= 0.0) {
                throw new IllegalArgumentException("reliability weight must be positive: " + model);
            }
        });
        if (defaultReliability <= 0.0) {
            throw new IllegalArgumentException("defaultReliability must be positive");
        }
        if (singleModelConfidenceCap >= highConfidenceThreshold) {
            throw new IllegalArgumentException(
                "singleModelConfidenceCap must be below highConfidenceThreshold");
        }
        if (maxVariance <= 0.0) {
            throw new IllegalArgumentException("maxVariance must be positive");
        }
    }

    public static FusionSettings defaults() {
        return new FusionSettings(
            Map.of(LEXICON, 0.3, HOSPITALITY, 0.2, TRANSFORMER, 0.5),
            0.25,
            0.7,
            0.8,
            1.0
        );
    }

    public double reliabilityOf(String modelName) {
        return reliabilityWeights.getOrDefault(modelName, defaultReliability);
    }
}
