package com.venuepulse.common.analytics;

import com.venuepulse.common.exception.InvalidParametersException;
import com.venuepulse.common.model.ComparisonResult;
import com.venuepulse.common.model.Mention;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ranks a fixed set of entities on one or more {@link ComparisonMetric}s.
 *
 * <p>Ranking per metric: valued entities by value descending, ties by entity name ascending,
 * followed by entities without a value in name order. Every requested entity appears in
 * every ranking exactly once.
 */
public class ComparisonEngine {

    public ComparisonResult compare(List<String> entities, List<String> metricNames, int windowDays,
                                    Collection<Mention> mentions, Instant now) {
        if (entities == null || entities.isEmpty()) {
            throw new InvalidParametersException("At least one entity is required");
        }
        if (metricNames == null || metricNames.isEmpty()) {
            throw new InvalidParametersException("At least one metric is required");
        }
        if (windowDays <= 0) {
            throw new InvalidParametersException("window_days must be positive: " + windowDays);
        }
        Set<ComparisonMetric> metrics = new LinkedHashSet<>();
        for (String name : metricNames) {
            metrics.add(ComparisonMetric.parse(name));
        }
        List<String> requested = List.copyOf(new LinkedHashSet<>(entities));

        List<Mention> selected = MentionWindow.select(
            mentions, Set.copyOf(requested), MentionWindow.windowStart(now, windowDays), now);

        Map<String, List<Mention>> byEntity = new LinkedHashMap<>();
        requested.forEach(e -> byEntity.put(e, new ArrayList<>()));
        selected.forEach(m -> byEntity.get(m.entityName()).add(m));

        Map<String, Map<String, Double>> values = new LinkedHashMap<>();
        for (String entity : requested) {
            Map<String, Double> row = new LinkedHashMap<>();
            for (ComparisonMetric metric : metrics) {
                row.put(metric.wireName(), metric.compute(byEntity.get(entity)));
            }
            values.put(entity, row);
        }

        Map<String, List<String>> rankings = new LinkedHashMap<>();
        for (ComparisonMetric metric : metrics) {
            rankings.put(metric.wireName(), rank(requested, values, metric.wireName()));
        }

        List<String> metricWireNames = metrics.stream().map(ComparisonMetric::wireName).toList();
        return new ComparisonResult(requested, metricWireNames, windowDays, values, rankings);
    }

    private static List<String> rank(List<String> entities, Map<String, Map<String, Double>> values, String metric) {
        Comparator<String> byValue = Comparator.comparing(
            (String e) -> values.get(e).get(metric),
            Comparator.nullsLast(Comparator.reverseOrder()));
        return entities.stream()
            .sorted(byValue.thenComparing(Comparator.naturalOrder()))
            .toList();
    }
}
