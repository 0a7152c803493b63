package com.venuepulse.sentiment.support;

import com.venuepulse.common.model.ModelOutcome;
import com.venuepulse.common.model.ModelRole;
import com.venuepulse.sentiment.adapter.ModelAdapter;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** Adapter whose behaviour per text is a plain function. */
public class StubModelAdapter implements ModelAdapter {

    private final String name;
    private final ModelRole role;
    private final boolean local;
    private final Function<String, Mono<ModelOutcome.Scored>> behaviour;
    private final AtomicInteger calls = new AtomicInteger();

    public StubModelAdapter(String name, ModelRole role, boolean local,
                            Function<String, Mono<ModelOutcome.Scored>> behaviour) {
        this.name      = name;
        this.role      = role;
        this.local     = local;
        this.behaviour = behaviour;
    }

    /** Local sentiment model answering every text with the same score. */
    public static StubModelAdapter fixed(String name, double score, double confidence) {
        return new StubModelAdapter(name, ModelRole.SENTIMENT, true,
            text -> Mono.just(new ModelOutcome.Scored(name, ModelRole.SENTIMENT, score, confidence, Map.of())));
    }

    /** Local sentiment model answering with the (score, confidence) the table lists for the text. */
    public static StubModelAdapter table(String name, Map<String, double[]> byText) {
        return new StubModelAdapter(name, ModelRole.SENTIMENT, true, text -> {
            double[] sc = byText.get(text);
            return sc == null
                ? Mono.error(new IllegalStateException("no entry for " + text))
                : Mono.just(new ModelOutcome.Scored(name, ModelRole.SENTIMENT, sc[0], sc[1], Map.of()));
        });
    }

    public static StubModelAdapter failing(String name, RuntimeException error) {
        return new StubModelAdapter(name, ModelRole.SENTIMENT, true, text -> Mono.error(error));
    }

    @Override
    public String modelName() {
        return name;
    }

    @Override
    public ModelRole role() {
        return role;
    }

    @Override
    public boolean local() {
        return local;
    }

    @Override
    public Mono<ModelOutcome.Scored> score(String text) {
        calls.incrementAndGet();
        return behaviour.apply(text);
    }

    public int calls() {
        return calls.get();
    }
}
