package com.venuepulse.common.quality;

import com.venuepulse.common.model.QualityMetricsSnapshot;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Running counters for one processing run, turned into a {@link QualityMetricsSnapshot} when
 * the run completes. Methods are synchronized: scoring results arrive from parallel workers.
 */
public class QualityRunTally {

    private int total;
    private int valid;
    private int invalid;
    private int spam;
    private int duplicates;
    private int scored;
    private int scoringErrors;
    private double confidenceSum;
    private final Set<String> entities = new HashSet<>();

    public synchronized void recordVerdict(ValidationVerdict verdict) {
        total++;
        if (verdict.accepted()) {
            valid++;
            return;
        }
        invalid++;
        if (verdict.hasCategory(RejectionCategory.SPAM)) spam++;
        if (verdict.hasCategory(RejectionCategory.DUPLICATE)) duplicates++;
    }

    public synchronized void recordScored(String entityName, double confidence) {
        scored++;
        confidenceSum += confidence;
        entities.add(entityName);
    }

    public synchronized void recordScoringError() {
        scoringErrors++;
    }

    public synchronized int totalProcessed() {
        return total;
    }

    public synchronized QualityMetricsSnapshot snapshot(Instant processedAt, QualityScoreCalculator calculator) {
        double acceptanceRate = total == 0 ? 0.0 : (double) valid / total;
        double spamFraction   = total == 0 ? 0.0 : (double) spam / total;
        double avgConfidence  = scored == 0 ? 0.0 : confidenceSum / scored;
        double qualityScore   = calculator.score(total, acceptanceRate, avgConfidence, spamFraction);
        return new QualityMetricsSnapshot(
            processedAt,
            total,
            valid,
            invalid,
            spam,
            duplicates,
            scoringErrors,
            scored,
            entities.size(),
            avgConfidence,
            qualityScore
        );
    }
}
