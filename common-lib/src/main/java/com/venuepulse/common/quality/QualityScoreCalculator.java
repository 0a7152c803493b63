package com.venuepulse.common.quality;

/**
 * <pre>
 *   qualityScore = clamp01(acceptanceWeight × acceptanceRate
 *                        + confidenceWeight × averageConfidence
 *                        − spamPenalty      × spamFraction)
 * </pre>
 * An empty batch scores 0.
 */
public final class QualityScoreCalculator {

    private final QualityWeights weights;

    public QualityScoreCalculator(QualityWeights weights) {
        this.weights = weights;
    }

    public double score(int total, double acceptanceRate, double averageConfidence, double spamFraction) {
        if (total == 0) {
            return 0.0;
        }
        double raw = weights.acceptanceWeight() * acceptanceRate
                   + weights.confidenceWeight() * averageConfidence
                   - weights.spamPenalty() * spamFraction;
        return Math.max(0.0, Math.min(1.0, raw));
    }
}
