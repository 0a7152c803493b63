package com.venuepulse.common.analytics;

import com.venuepulse.common.exception.InvalidParametersException;
import com.venuepulse.common.model.Granularity;
import com.venuepulse.common.model.Mention;
import com.venuepulse.common.model.TrendPoint;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Buckets scored mentions into {@link TrendPoint}s.
 *
 * <p>Buckets are UTC-aligned per {@link Granularity#bucketStart(Instant)}. Buckets with no
 * mentions are not emitted. Output is sorted by entity name, then bucket start. Means are
 * plain (unweighted) and label counts are exact.
 */
public class TrendAggregator {

    /**
     * @param mentions    candidate mentions; anything outside the window or the entity filter is ignored
     * @param entities    entity filter, {@code null} or empty for all entities
     * @param windowDays  look-back in days, must be positive
     * @param granularity bucket size
     * @param now         end of the window, inclusive
     */
    public List<TrendPoint> aggregate(Collection<Mention> mentions, Set<String> entities,
                                      int windowDays, Granularity granularity, Instant now) {
        if (windowDays <= 0) {
            throw new InvalidParametersException("window_days must be positive: " + windowDays);
        }
        List<Mention> selected = MentionWindow.select(
            mentions, entities, MentionWindow.windowStart(now, windowDays), now);

        Map<String, Map<Instant, List<Mention>>> grouped = new TreeMap<>();
        for (Mention m : selected) {
            grouped.computeIfAbsent(m.entityName(), k -> new TreeMap<>())
                   .computeIfAbsent(granularity.bucketStart(m.createdAt()), k -> new ArrayList<>())
                   .add(m);
        }

        List<TrendPoint> points = new ArrayList<>();
        grouped.forEach((entity, buckets) ->
            buckets.forEach((start, bucket) -> points.add(toPoint(entity, start, granularity, bucket))));
        return points;
    }

    private static TrendPoint toPoint(String entity, Instant start, Granularity granularity, List<Mention> bucket) {
        double scoreSum = 0.0;
        double confidenceSum = 0.0;
        int positive = 0;
        int negative = 0;
        int neutral  = 0;
        for (Mention m : bucket) {
            scoreSum      += m.sentiment().score();
            confidenceSum += m.sentiment().confidence();
            switch (m.label()) {
                case POSITIVE -> positive++;
                case NEGATIVE -> negative++;
                case NEUTRAL  -> neutral++;
            }
        }
        int n = bucket.size();
        return new TrendPoint(entity, start, granularity, n,
            scoreSum / n, confidenceSum / n, positive, negative, neutral);
    }
}
