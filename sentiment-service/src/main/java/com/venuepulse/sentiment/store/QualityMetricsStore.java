package com.venuepulse.sentiment.store;

import com.venuepulse.common.model.QualityMetricsSnapshot;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

public interface QualityMetricsStore {

    Mono<QualityMetricsSnapshot> save(QualityMetricsSnapshot snapshot);

    /** Most recent first. */
    Flux<QualityMetricsSnapshot> recent(int limit);

    Flux<QualityMetricsSnapshot> since(Instant from);
}
