package com.venuepulse.common.fusion;

import com.venuepulse.common.model.EmotionProfile;
import com.venuepulse.common.model.SentimentResult;

import java.util.List;

/**
 * Output of a {@link FusionScorer} run. {@code emotions} is {@code null} when no model
 * produced an emotion vector.
 */
public record FusionResult(
    SentimentResult sentiment,
    EmotionProfile emotions,
    List<String> failedModels
) {
    public FusionResult {
        failedModels = List.copyOf(failedModels);
    }
}
