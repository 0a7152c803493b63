package com.venuepulse.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One (entity, bucket) aggregate. Derived from persisted mentions on every request.
 */
public record TrendPoint(
    @JsonProperty("entity_name")    String entityName,
    @JsonProperty("bucket_start")   Instant bucketStart,
    @JsonProperty("granularity")    Granularity granularity,
    @JsonProperty("mention_count")  int mentionCount,
    @JsonProperty("avg_sentiment")  double avgSentiment,
    @JsonProperty("avg_confidence") double avgConfidence,
    @JsonProperty("positive_count") int positiveCount,
    @JsonProperty("negative_count") int negativeCount,
    @JsonProperty("neutral_count")  int neutralCount
) {}
