package com.venuepulse.common.quality;

/**
 * Coefficients of the run quality score. All must be non-negative, which keeps the score
 * non-decreasing in acceptance rate and confidence and non-increasing in spam fraction.
 */
public record QualityWeights(double acceptanceWeight, double confidenceWeight, double spamPenalty) {

    public QualityWeights {
        if (acceptanceWeight < 0.0 || confidenceWeight < 0.0 || spamPenalty < 0.0) {
            throw new IllegalArgumentException("quality weights must be non-negative");
        }
    }

    public static QualityWeights defaults() {
        return new QualityWeights(0.6, 0.4, 0.2);
    }
}
