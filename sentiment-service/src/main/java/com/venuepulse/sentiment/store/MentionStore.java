package com.venuepulse.sentiment.store;

import com.venuepulse.common.model.Mention;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence of scored mentions. Each write stores the whole record atomically, so readers
 * never observe a partially written mention.
 */
public interface MentionStore {

    /** Inserts a new mention; fails if its source id is already stored. */
    Mono<Mention> save(Mention mention);

    /** Inserts, or fully replaces the mention with the same source id. */
    Mono<Mention> upsert(Mention mention);

    Flux<Mention> query(MentionQuery query);
}
