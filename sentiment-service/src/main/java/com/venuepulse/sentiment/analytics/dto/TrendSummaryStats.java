package com.venuepulse.sentiment.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TrendSummaryStats(
    @JsonProperty("total_mentions")    int totalMentions,
    @JsonProperty("average_sentiment") double averageSentiment,
    @JsonProperty("period_days")       int periodDays,
    @JsonProperty("entities_analyzed") int entitiesAnalyzed
) {}
