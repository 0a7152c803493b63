package com.venuepulse.sentiment.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TopicCount(
    @JsonProperty("topic") String topic,
    @JsonProperty("count") int count
) {}
