package com.venuepulse.sentiment.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.venuepulse.common.model.Granularity;
import com.venuepulse.common.model.TrendPoint;

import java.time.Instant;
import java.util.List;

public record TrendReport(
    @JsonProperty("period_start")  Instant periodStart,
    @JsonProperty("period_end")    Instant periodEnd,
    @JsonProperty("granularity")   Granularity granularity,
    @JsonProperty("trends")        List<TrendPoint> trends,
    @JsonProperty("summary_stats") TrendSummaryStats summaryStats
) {}
