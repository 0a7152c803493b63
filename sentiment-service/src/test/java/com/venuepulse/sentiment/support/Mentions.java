package com.venuepulse.sentiment.support;

import com.venuepulse.common.model.EmotionProfile;
import com.venuepulse.common.model.Mention;
import com.venuepulse.common.model.QualityMetricsSnapshot;
import com.venuepulse.common.model.SentimentResult;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

public final class Mentions {

    private Mentions() {}

    public static Mention mention(String sourceId, String entity, double score, double confidence,
                                  Instant createdAt, Set<String> tags, Map<String, Double> emotions) {
        return new Mention(null, entity, sourceId, "text for " + sourceId, createdAt,
            SentimentResult.of(score, confidence, Map.of("lexicon", score)),
            emotions == null ? null : new EmotionProfile(emotions),
            tags, false, null);
    }

    public static Mention mention(String sourceId, String entity, double score, double confidence, Instant createdAt) {
        return mention(sourceId, entity, score, confidence, createdAt, Set.of(), null);
    }

    public static QualityMetricsSnapshot snapshot(Instant processedAt, double qualityScore) {
        return new QualityMetricsSnapshot(processedAt, 10, 8, 2, 1, 1, 0, 8, 2, 0.7, qualityScore);
    }
}
