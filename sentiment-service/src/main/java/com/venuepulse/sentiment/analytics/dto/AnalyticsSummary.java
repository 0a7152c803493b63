package com.venuepulse.sentiment.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Dashboard overview. {@code dataQualityScore} is null when no run finished in the last week.
 */
public record AnalyticsSummary(
    @JsonProperty("total_mentions")         int totalMentions,
    @JsonProperty("unique_entities")        int uniqueEntities,
    @JsonProperty("avg_sentiment_score")    double avgSentimentScore,
    @JsonProperty("sentiment_distribution") SentimentDistribution sentimentDistribution,
    @JsonProperty("top_entities")           List<TopEntity> topEntities,
    @JsonProperty("trending_topics")        List<TopicCount> trendingTopics,
    @JsonProperty("data_quality_score")     Double dataQualityScore,
    @JsonProperty("analysis_date")          Instant analysisDate
) {}
