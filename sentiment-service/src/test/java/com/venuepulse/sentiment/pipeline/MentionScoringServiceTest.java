package com.venuepulse.sentiment.pipeline;

import com.venuepulse.common.exception.EnsembleExhaustedException;
import com.venuepulse.common.fusion.ConfidenceWeightedFusionStrategy;
import com.venuepulse.common.fusion.FusionSettings;
import com.venuepulse.common.model.ModelOutcome;
import com.venuepulse.common.model.ModelRole;
import com.venuepulse.common.model.RawMention;
import com.venuepulse.sentiment.adapter.ModelAdapter;
import com.venuepulse.sentiment.dispatch.DispatchSettings;
import com.venuepulse.sentiment.dispatch.ModelDispatchService;
import com.venuepulse.sentiment.job.ProcessingMode;
import com.venuepulse.sentiment.support.InMemoryMentionStore;
import com.venuepulse.sentiment.support.StubModelAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MentionScoringServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-14T12:00:00Z");

    private InMemoryMentionStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryMentionStore();
    }

    private MentionScoringService service(ModelAdapter... adapters) {
        ModelDispatchService dispatch = new ModelDispatchService(List.of(adapters),
            new DispatchSettings(Duration.ofSeconds(2), Map.of()));
        return new MentionScoringService(dispatch,
            new ConfidenceWeightedFusionStrategy(FusionSettings.defaults()), store,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("sentiment and emotion outcomes combine into one persisted mention")
    void scoresAndPersists() {
        StubModelAdapter emotion = new StubModelAdapter("emotion", ModelRole.EMOTION, true,
            text -> Mono.just(ModelOutcome.emotion("emotion", 0.9, Map.of("joy", 0.9))));
        RawMention raw = new RawMention("Lovely wine list", "Stillwell", null, "s1", true,
            "https://example.org/s1", "comment", false);

        StepVerifier.create(service(StubModelAdapter.fixed("lexicon", 0.4, 0.8), emotion)
                .score(raw, "Stillwell", ProcessingMode.ADVANCED))
            .assertNext(m -> {
                assertNotNull(m.id());
                assertEquals("Stillwell", m.entityName());
                assertEquals(0.4, m.sentiment().score(), 1e-9);
                assertEquals(Map.of("joy", 0.9), m.emotions().intensities());
                assertEquals(NOW, m.createdAt());
                assertTrue(m.derived());
                assertEquals("https://example.org/s1", m.sourceUrl());
                assertTrue(m.topicTags().contains("wine"));
            })
            .verifyComplete();
        assertEquals(1, store.size());
    }

    @Test
    @DisplayName("every sentiment model failing persists nothing")
    void exhausted() {
        RawMention raw = RawMention.of("s2", "Stillwell", "Nice patio out back", NOW);

        StepVerifier.create(service(
                StubModelAdapter.failing("lexicon", new IllegalStateException("boom")),
                StubModelAdapter.failing("hospitality", new IllegalStateException("boom")))
                .score(raw, "Stillwell", ProcessingMode.BASIC))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(EnsembleExhaustedException.class, e);
                assertEquals(List.of("hospitality", "lexicon"), ((EnsembleExhaustedException) e).getFailedModels());
            })
            .verify();
        assertEquals(0, store.size());
    }
}
