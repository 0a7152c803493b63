package com.venuepulse.sentiment.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.venuepulse.common.model.QualityMetricsSnapshot;

/**
 * Result of one completed processing run, kept on the job record.
 */
public record RunSummary(
    @JsonProperty("total_processed")   int totalProcessed,
    @JsonProperty("valid_count")       int validCount,
    @JsonProperty("invalid_count")     int invalidCount,
    @JsonProperty("mentions_scored")   int mentionsScored,
    @JsonProperty("scoring_errors")    int scoringErrors,
    @JsonProperty("unique_entities")   int uniqueEntities,
    @JsonProperty("quality_score")     double qualityScore
) {
    public static RunSummary of(QualityMetricsSnapshot snapshot) {
        return new RunSummary(
            snapshot.totalProcessed(),
            snapshot.validCount(),
            snapshot.invalidCount(),
            snapshot.mentionsFound(),
            snapshot.scoringErrorCount(),
            snapshot.uniqueEntities(),
            snapshot.qualityScore()
        );
    }
}
