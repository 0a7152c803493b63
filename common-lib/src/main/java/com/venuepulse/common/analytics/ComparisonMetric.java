package com.venuepulse.common.analytics;

import com.venuepulse.common.exception.InvalidParametersException;
import com.venuepulse.common.model.Mention;
import com.venuepulse.common.model.SentimentLabel;

import java.util.List;
import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Metrics the comparison engine can rank entities by.
 *
 * <p>Average-like metrics have no value for an entity without mentions; count-like metrics
 * report 0.
 */
public enum ComparisonMetric {
    AVG_SENTIMENT("avg_sentiment"),
    TOTAL_MENTIONS("total_mentions"),
    AVG_CONFIDENCE("avg_confidence"),
    POSITIVE_RATIO("positive_ratio"),
    NEGATIVE_RATIO("negative_ratio");

    public static final List<ComparisonMetric> DEFAULTS = List.of(AVG_SENTIMENT, TOTAL_MENTIONS, AVG_CONFIDENCE);

    private final String wireName;

    ComparisonMetric(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Accepts the wire names plus the short aliases {@code sentiment}, {@code mentions} and
     * {@code confidence}.
     *
     * @throws InvalidParametersException for anything else
     */
    public static ComparisonMetric parse(String name) {
        if (name == null) {
            throw new InvalidParametersException("metric must not be null");
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        switch (key) {
            case "sentiment":  return AVG_SENTIMENT;
            case "mentions":   return TOTAL_MENTIONS;
            case "confidence": return AVG_CONFIDENCE;
            default:
                for (ComparisonMetric m : values()) {
                    if (m.wireName.equals(key)) return m;
                }
                throw new InvalidParametersException("Unknown comparison metric: " + name);
        }
    }

    /**
     * @param mentions the entity's mentions, already sorted into a stable order
     * @return the metric value, or {@code null} for an average-like metric over no mentions
     */
    Double compute(List<Mention> mentions) {
        if (this == TOTAL_MENTIONS) {
            return (double) mentions.size();
        }
        if (mentions.isEmpty()) {
            return null;
        }
        return switch (this) {
            case AVG_SENTIMENT  -> mean(mentions, m -> m.sentiment().score());
            case AVG_CONFIDENCE -> mean(mentions, m -> m.sentiment().confidence());
            case POSITIVE_RATIO -> mean(mentions, m -> m.label() == SentimentLabel.POSITIVE ? 1.0 : 0.0);
            case NEGATIVE_RATIO -> mean(mentions, m -> m.label() == SentimentLabel.NEGATIVE ? 1.0 : 0.0);
            case TOTAL_MENTIONS -> (double) mentions.size();
        };
    }

    private static double mean(List<Mention> mentions, ToDoubleFunction<Mention> f) {
        double sum = 0.0;
        for (Mention m : mentions) {
            sum += f.applyAsDouble(m);
        }
        return sum / mentions.size();
    }
}
