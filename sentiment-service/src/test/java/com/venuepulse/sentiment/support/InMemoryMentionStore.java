package com.venuepulse.sentiment.support;

import com.venuepulse.common.model.Mention;
import com.venuepulse.sentiment.store.MentionQuery;
import com.venuepulse.sentiment.store.MentionStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/** Map-backed {@link MentionStore} keyed by source id. */
public class InMemoryMentionStore implements MentionStore {

    private final Map<String, Mention> bySourceId = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();

    @Override
    public Mono<Mention> save(Mention mention) {
        return Mono.fromCallable(() -> {
            failIfRequested();
            Mention stored = mention.withId(ids.incrementAndGet());
            if (bySourceId.putIfAbsent(mention.sourceId(), stored) != null) {
                throw new IllegalStateException("duplicate source id " + mention.sourceId());
            }
            return stored;
        });
    }

    @Override
    public Mono<Mention> upsert(Mention mention) {
        return Mono.fromCallable(() -> {
            failIfRequested();
            return bySourceId.compute(mention.sourceId(), (key, existing) ->
                mention.withId(existing != null ? existing.id() : ids.incrementAndGet()));
        });
    }

    @Override
    public Flux<Mention> query(MentionQuery query) {
        return Flux.defer(() -> {
            failIfRequested();
            List<Mention> matching = bySourceId.values().stream()
                .filter(query::matches)
                .sorted(Comparator.comparing(Mention::createdAt).reversed()
                    .thenComparing(Mention::sourceId))
                .limit(query.limit() == null ? Long.MAX_VALUE : query.limit())
                .toList();
            return Flux.fromIterable(matching);
        });
    }

    public void add(Mention... mentions) {
        for (Mention m : mentions) {
            bySourceId.put(m.sourceId(), m.withId(ids.incrementAndGet()));
        }
    }

    public Mention get(String sourceId) {
        return bySourceId.get(sourceId);
    }

    public int size() {
        return bySourceId.size();
    }

    /** Every later call fails with {@code e}. */
    public void failWith(RuntimeException e) {
        failure.set(e);
    }

    private void failIfRequested() {
        RuntimeException e = failure.get();
        if (e != null) {
            throw e;
        }
    }
}
