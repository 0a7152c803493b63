package com.venuepulse.sentiment.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SentimentDistribution(
    @JsonProperty("positive") int positive,
    @JsonProperty("negative") int negative,
    @JsonProperty("neutral")  int neutral
) {}
