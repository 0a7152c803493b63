package com.venuepulse.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Per-request comparison of entities across metrics.
 *
 * <p>{@code perEntityValues} holds {@code null} for an average-like metric when the entity had
 * no qualifying mentions. Each ranking lists every requested entity exactly once.
 */
public record ComparisonResult(
    @JsonProperty("bars")            List<String> entities,
    @JsonProperty("metrics")         List<String> metrics,
    @JsonProperty("analysis_period") int windowDays,
    @JsonProperty("comparison_data") Map<String, Map<String, Double>> perEntityValues,
    @JsonProperty("rankings")        Map<String, List<String>> rankings
) {}
