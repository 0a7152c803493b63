package com.venuepulse.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable data-quality record written once per completed processing run.
 */
public record QualityMetricsSnapshot(
    @JsonProperty("processed_at")             Instant processedAt,
    @JsonProperty("total_processed")          int totalProcessed,
    @JsonProperty("valid_count")              int validCount,
    @JsonProperty("invalid_count")            int invalidCount,
    @JsonProperty("spam_filtered_count")      int spamFilteredCount,
    @JsonProperty("duplicate_filtered_count") int duplicateFilteredCount,
    @JsonProperty("scoring_error_count")      int scoringErrorCount,
    @JsonProperty("mentions_found")           int mentionsFound,
    @JsonProperty("unique_entities")          int uniqueEntities,
    @JsonProperty("average_confidence")       double averageConfidence,
    @JsonProperty("quality_score")            double qualityScore
) {}
