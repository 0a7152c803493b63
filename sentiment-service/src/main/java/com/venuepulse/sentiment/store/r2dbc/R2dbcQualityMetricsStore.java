package com.venuepulse.sentiment.store.r2dbc;

import com.venuepulse.common.model.QualityMetricsSnapshot;
import com.venuepulse.sentiment.store.QualityMetricsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Component
public class R2dbcQualityMetricsStore implements QualityMetricsStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcQualityMetricsStore.class);

    private final QualityMetricsRepository repository;

    public R2dbcQualityMetricsStore(QualityMetricsRepository repository) {
        this.repository = repository;
    }

    @Override
    public Mono<QualityMetricsSnapshot> save(QualityMetricsSnapshot snapshot) {
        return Mono.fromCallable(() -> toEntity(snapshot))
            .flatMap(repository::save)
            .map(R2dbcQualityMetricsStore::toSnapshot)
            .doOnSuccess(s -> log.info("Quality snapshot persisted. total={} valid={} qualityScore={}",
                s.totalProcessed(), s.validCount(), s.qualityScore()));
    }

    @Override
    public Flux<QualityMetricsSnapshot> recent(int limit) {
        return repository.findRecent(limit).map(R2dbcQualityMetricsStore::toSnapshot);
    }

    @Override
    public Flux<QualityMetricsSnapshot> since(Instant from) {
        return repository.findByProcessedAtGreaterThanEqualOrderByProcessedAtDesc(
                LocalDateTime.ofInstant(from, ZoneOffset.UTC))
            .map(R2dbcQualityMetricsStore::toSnapshot);
    }

    static QualityMetricsEntity toEntity(QualityMetricsSnapshot s) {
        QualityMetricsEntity e = new QualityMetricsEntity();
        e.setProcessedAt(LocalDateTime.ofInstant(s.processedAt(), ZoneOffset.UTC));
        e.setTotalProcessed(s.totalProcessed());
        e.setValidCount(s.validCount());
        e.setInvalidCount(s.invalidCount());
        e.setSpamFilteredCount(s.spamFilteredCount());
        e.setDuplicateFilteredCount(s.duplicateFilteredCount());
        e.setScoringErrorCount(s.scoringErrorCount());
        e.setMentionsFound(s.mentionsFound());
        e.setUniqueEntities(s.uniqueEntities());
        e.setAverageConfidence(s.averageConfidence());
        e.setQualityScore(s.qualityScore());
        return e;
    }

    static QualityMetricsSnapshot toSnapshot(QualityMetricsEntity e) {
        return new QualityMetricsSnapshot(
            e.getProcessedAt().toInstant(ZoneOffset.UTC),
            e.getTotalProcessed(),
            e.getValidCount(),
            e.getInvalidCount(),
            e.getSpamFilteredCount(),
            e.getDuplicateFilteredCount(),
            e.getScoringErrorCount(),
            e.getMentionsFound(),
            e.getUniqueEntities(),
            e.getAverageConfidence(),
            e.getQualityScore()
        );
    }
}
