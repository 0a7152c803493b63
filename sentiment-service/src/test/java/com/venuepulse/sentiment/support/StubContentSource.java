package com.venuepulse.sentiment.support;

import com.venuepulse.common.model.RawMention;
import com.venuepulse.sentiment.source.BatchSelector;
import com.venuepulse.sentiment.source.ContentSource;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/** Serves a fixed list of items, or a fixed error, for every selector. */
public class StubContentSource implements ContentSource {

    private final List<RawMention> items;
    private final RuntimeException error;
    private final AtomicInteger fetches = new AtomicInteger();

    private StubContentSource(List<RawMention> items, RuntimeException error) {
        this.items = items;
        this.error = error;
    }

    public static StubContentSource of(RawMention... items) {
        return new StubContentSource(List.of(items), null);
    }

    public static StubContentSource failing(RuntimeException error) {
        return new StubContentSource(List.of(), error);
    }

    @Override
    public Flux<RawMention> fetch(BatchSelector selector) {
        fetches.incrementAndGet();
        if (error != null) {
            return Flux.error(error);
        }
        return Flux.fromIterable(items).take(selector.limit());
    }

    public int fetchCount() {
        return fetches.get();
    }
}
