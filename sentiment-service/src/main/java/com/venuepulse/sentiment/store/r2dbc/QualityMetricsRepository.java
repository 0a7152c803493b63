package com.venuepulse.sentiment.store.r2dbc;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;

@Repository
public interface QualityMetricsRepository extends ReactiveCrudRepository<QualityMetricsEntity, Long> {

    @Query("""
        SELECT * FROM quality_metrics
        ORDER BY processed_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<QualityMetricsEntity> findRecent(int limit);

    Flux<QualityMetricsEntity> findByProcessedAtGreaterThanEqualOrderByProcessedAtDesc(LocalDateTime from);
}
