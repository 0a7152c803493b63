package com.venuepulse.sentiment.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TopEntity(
    @JsonProperty("name")      String name,
    @JsonProperty("mentions")  int mentions,
    @JsonProperty("sentiment") double sentiment
) {}
