package com.venuepulse.sentiment.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * All-time totals for one entity. {@code topEmotions} averages the emotion profiles of the
 * mentions that have one.
 */
public record EntitySummary(
    @JsonProperty("name")                   String name,
    @JsonProperty("total_mentions")         int totalMentions,
    @JsonProperty("avg_sentiment")          double avgSentiment,
    @JsonProperty("avg_confidence")         double avgConfidence,
    @JsonProperty("sentiment_distribution") SentimentDistribution sentimentDistribution,
    @JsonProperty("first_mention")          Instant firstMention,
    @JsonProperty("last_mention")           Instant lastMention,
    @JsonProperty("top_emotions")           Map<String, Double> topEmotions,
    @JsonProperty("topic_tags")             List<TopicCount> topicTags
) {}
