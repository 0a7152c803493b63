package com.venuepulse.sentiment.analytics;

import com.venuepulse.common.analytics.ComparisonEngine;
import com.venuepulse.common.analytics.ComparisonMetric;
import com.venuepulse.common.analytics.TrendAggregator;
import com.venuepulse.common.exception.InvalidParametersException;
import com.venuepulse.common.model.ComparisonResult;
import com.venuepulse.common.model.EmotionProfile;
import com.venuepulse.common.model.Granularity;
import com.venuepulse.common.model.Mention;
import com.venuepulse.common.model.QualityMetricsSnapshot;
import com.venuepulse.common.model.SentimentLabel;
import com.venuepulse.common.model.TrendPoint;
import com.venuepulse.common.text.EntityCatalog;
import com.venuepulse.sentiment.analytics.dto.AnalyticsSummary;
import com.venuepulse.sentiment.analytics.dto.EntitySummary;
import com.venuepulse.sentiment.analytics.dto.SentimentDistribution;
import com.venuepulse.sentiment.analytics.dto.TopEntity;
import com.venuepulse.sentiment.analytics.dto.TopicCount;
import com.venuepulse.sentiment.analytics.dto.TrendReport;
import com.venuepulse.sentiment.analytics.dto.TrendSummaryStats;
import com.venuepulse.sentiment.store.MentionQuery;
import com.venuepulse.sentiment.store.MentionStore;
import com.venuepulse.sentiment.store.QualityMetricsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Read-side facade over persisted mentions and quality snapshots.
 *
 * <p>Parameters are checked before any store access; violations throw
 * {@link InvalidParametersException} from the calling thread. Entity names given by callers
 * are mapped to canonical names through the {@link EntityCatalog}. Empty data yields empty
 * results, never errors.
 */
@Service
public class AnalyticsQueryService {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsQueryService.class);

    public static final int MIN_DAYS           = 1;
    public static final int MAX_DAYS           = 365;
    public static final int MAX_LIMIT          = 100;
    public static final int TOP_ENTITIES       = 10;
    public static final int TRENDING_TOPICS    = 10;
    public static final int TOP_EMOTIONS       = 3;
    public static final int TRENDING_WINDOW_DAYS = 30;
    public static final int QUALITY_WINDOW_DAYS  = 7;

    private final MentionStore mentionStore;
    private final QualityMetricsStore qualityStore;
    private final TrendAggregator trendAggregator;
    private final ComparisonEngine comparisonEngine;
    private final EntityCatalog catalog;
    private final Clock clock;

    public AnalyticsQueryService(MentionStore mentionStore,
                                 QualityMetricsStore qualityStore,
                                 TrendAggregator trendAggregator,
                                 ComparisonEngine comparisonEngine,
                                 EntityCatalog catalog,
                                 Clock clock) {
        this.mentionStore     = mentionStore;
        this.qualityStore     = qualityStore;
        this.trendAggregator  = trendAggregator;
        this.comparisonEngine = comparisonEngine;
        this.catalog          = catalog;
        this.clock            = clock;
    }

    // ── Summary ─────────────────────────────────────────────────────────────

    public Mono<AnalyticsSummary> getAnalyticsSummary() {
        Instant now = clock.instant();
        Instant trendingFrom = now.minus(Duration.ofDays(TRENDING_WINDOW_DAYS));
        Instant qualityFrom  = now.minus(Duration.ofDays(QUALITY_WINDOW_DAYS));

        Mono<List<Mention>> mentions = mentionStore.query(MentionQuery.all()).collectList();
        Mono<Double> quality = qualityStore.since(qualityFrom)
            .map(QualityMetricsSnapshot::qualityScore)
            .collectList()
            .map(scores -> scores.isEmpty()
                ? Double.NaN
                : scores.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN));

        return Mono.zip(mentions, quality)
            .map(t -> {
                List<Mention> all = t.getT1();
                Double dataQuality = Double.isNaN(t.getT2()) ? null : t.getT2();
                List<Mention> recent = all.stream()
                    .filter(m -> !m.createdAt().isBefore(trendingFrom))
                    .toList();
                return new AnalyticsSummary(
                    all.size(),
                    (int) all.stream().map(Mention::entityName).distinct().count(),
                    meanScore(all),
                    distribution(all),
                    topEntities(all),
                    topicCounts(recent, TRENDING_TOPICS),
                    dataQuality,
                    now
                );
            })
            .doOnSuccess(s -> log.info("Analytics summary built. mentions={} entities={}",
                s.totalMentions(), s.uniqueEntities()));
    }

    // ── Trends ──────────────────────────────────────────────────────────────

    public Mono<TrendReport> getTrends(List<String> entities, int days, String granularity) {
        requireDays(days);
        Granularity g = Granularity.parse(granularity);
        Set<String> filter = canonical(entities);
        Instant now  = clock.instant();
        Instant from = now.minus(Duration.ofDays(days));

        return mentionStore.query(MentionQuery.window(filter, from, now))
            .collectList()
            .map(mentions -> {
                List<TrendPoint> points = trendAggregator.aggregate(mentions, filter, days, g, now);
                TrendSummaryStats stats = new TrendSummaryStats(
                    mentions.size(),
                    meanScore(mentions),
                    days,
                    (int) mentions.stream().map(Mention::entityName).distinct().count());
                return new TrendReport(from, now, g, points, stats);
            });
    }

    // ── Comparison ──────────────────────────────────────────────────────────

    public Mono<ComparisonResult> compareEntities(List<String> entities, List<String> metrics, int days) {
        requireDays(days);
        List<String> names = List.copyOf(canonical(entities));
        if (names.isEmpty()) {
            throw new InvalidParametersException("At least one entity is required");
        }
        List<String> metricNames = metrics == null || metrics.isEmpty()
            ? ComparisonMetric.DEFAULTS.stream().map(ComparisonMetric::wireName).toList()
            : metrics;
        metricNames.forEach(ComparisonMetric::parse);
        Instant now = clock.instant();

        return mentionStore.query(MentionQuery.window(Set.copyOf(names), now.minus(Duration.ofDays(days)), now))
            .collectList()
            .map(mentions -> comparisonEngine.compare(names, metricNames, days, mentions, now));
    }

    // ── Quality ─────────────────────────────────────────────────────────────

    public Flux<QualityMetricsSnapshot> getQualityMetrics(int limit) {
        requireLimit(limit);
        return qualityStore.recent(limit);
    }

    // ── Entity drill-down ───────────────────────────────────────────────────

    /** Empty when the entity has no mentions. */
    public Mono<EntitySummary> getEntitySummary(String name) {
        String entity = requireName(name);
        return mentionStore.query(MentionQuery.window(Set.of(entity), null, null))
            .collectList()
            .filter(mentions -> !mentions.isEmpty())
            .map(mentions -> new EntitySummary(
                entity,
                mentions.size(),
                meanScore(mentions),
                mentions.stream().mapToDouble(m -> m.sentiment().confidence()).average().orElse(0.0),
                distribution(mentions),
                mentions.stream().map(Mention::createdAt).min(Comparator.naturalOrder()).orElse(null),
                mentions.stream().map(Mention::createdAt).max(Comparator.naturalOrder()).orElse(null),
                topEmotions(mentions),
                topicCounts(mentions, Integer.MAX_VALUE)));
    }

    /** Newest first. */
    public Flux<Mention> getEntityMentions(String name, int limit) {
        String entity = requireName(name);
        requireLimit(limit);
        return mentionStore.query(MentionQuery.latest(entity, limit));
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private Set<String> canonical(Collection<String> names) {
        Set<String> result = new LinkedHashSet<>();
        if (names != null) {
            names.stream()
                .filter(n -> n != null && !n.isBlank())
                .forEach(n -> result.add(catalog.canonicalName(n)));
        }
        return result;
    }

    private String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidParametersException("entity name must not be blank");
        }
        return catalog.canonicalName(name);
    }

    private static void requireDays(int days) {
        if (days < MIN_DAYS || days > MAX_DAYS) {
            throw new InvalidParametersException("days must be in [" + MIN_DAYS + ", " + MAX_DAYS + "]: " + days);
        }
    }

    private static void requireLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidParametersException("limit must be in [1, " + MAX_LIMIT + "]: " + limit);
        }
    }

    private static double meanScore(List<Mention> mentions) {
        return mentions.stream()
            .sorted(Comparator.comparing(Mention::sourceId))
            .mapToDouble(m -> m.sentiment().score())
            .average()
            .orElse(0.0);
    }

    private static SentimentDistribution distribution(List<Mention> mentions) {
        int positive = 0;
        int negative = 0;
        int neutral  = 0;
        for (Mention m : mentions) {
            SentimentLabel label = m.label();
            if (label == SentimentLabel.POSITIVE) positive++;
            else if (label == SentimentLabel.NEGATIVE) negative++;
            else neutral++;
        }
        return new SentimentDistribution(positive, negative, neutral);
    }

    private static List<TopEntity> topEntities(List<Mention> mentions) {
        Map<String, List<Mention>> byEntity = new TreeMap<>();
        mentions.forEach(m -> byEntity.computeIfAbsent(m.entityName(), k -> new ArrayList<>()).add(m));
        return byEntity.entrySet().stream()
            .map(e -> new TopEntity(e.getKey(), e.getValue().size(), meanScore(e.getValue())))
            .sorted(Comparator.comparingInt(TopEntity::mentions).reversed()
                .thenComparing(TopEntity::name))
            .limit(TOP_ENTITIES)
            .toList();
    }

    private static List<TopicCount> topicCounts(List<Mention> mentions, int limit) {
        Map<String, Integer> counts = new HashMap<>();
        mentions.forEach(m -> m.topicTags().forEach(tag -> counts.merge(tag, 1, Integer::sum)));
        return counts.entrySet().stream()
            .map(e -> new TopicCount(e.getKey(), e.getValue()))
            .sorted(Comparator.comparingInt(TopicCount::count).reversed()
                .thenComparing(TopicCount::topic))
            .limit(limit)
            .toList();
    }

    private static Map<String, Double> topEmotions(List<Mention> mentions) {
        Map<String, double[]> totals = new TreeMap<>();
        mentions.stream()
            .filter(m -> m.emotions() != null)
            .forEach(m -> m.emotions().intensities().forEach((emotion, value) -> {
                double[] acc = totals.computeIfAbsent(emotion, k -> new double[2]);
                acc[0] += value;
                acc[1] += 1.0;
            }));
        if (totals.isEmpty()) {
            return Map.of();
        }
        Map<String, Double> averaged = new TreeMap<>();
        totals.forEach((emotion, acc) -> averaged.put(emotion, acc[0] / acc[1]));
        return new EmotionProfile(averaged).top(TOP_EMOTIONS);
    }
}
