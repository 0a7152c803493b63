package com.venuepulse.sentiment.pipeline;

import com.venuepulse.common.fusion.ConfidenceWeightedFusionStrategy;
import com.venuepulse.common.fusion.FusionSettings;
import com.venuepulse.common.model.Mention;
import com.venuepulse.common.model.QualityMetricsSnapshot;
import com.venuepulse.common.model.RawMention;
import com.venuepulse.common.model.SentimentLabel;
import com.venuepulse.common.quality.QualityScoreCalculator;
import com.venuepulse.common.quality.QualityWeights;
import com.venuepulse.common.quality.ValidatorSettings;
import com.venuepulse.common.text.EntityCatalog;
import com.venuepulse.sentiment.dispatch.DispatchSettings;
import com.venuepulse.sentiment.dispatch.ModelDispatchService;
import com.venuepulse.sentiment.job.ProcessingMode;
import com.venuepulse.sentiment.source.BatchSelector;
import com.venuepulse.sentiment.support.InMemoryMentionStore;
import com.venuepulse.sentiment.support.InMemoryQualityMetricsStore;
import com.venuepulse.sentiment.support.StubContentSource;
import com.venuepulse.sentiment.support.StubModelAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end run over in-memory collaborators: validation, parallel scoring, fusion,
 * persistence and the quality snapshot.
 */
class ProcessingRunServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-14T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final EntityCatalog CATALOG =
        new EntityCatalog(Map.of("The Halifax Pub", List.of("Halifax Pub")));
    private static final String PUB = "The Halifax Pub";

    private static final String T1 = "Great beer at the Halifax Pub tonight";
    private static final String T2 = "Service at the Halifax Pub was slow";
    private static final String T3 = "Went to the Halifax Pub for lunch";
    private static final String T4 = "Halifax Pub patio opens next week";

    private static final QualityScoreCalculator CALCULATOR = new QualityScoreCalculator(QualityWeights.defaults());

    private InMemoryMentionStore mentionStore;
    private InMemoryQualityMetricsStore qualityStore;

    @BeforeEach
    void setUp() {
        mentionStore = new InMemoryMentionStore();
        qualityStore = new InMemoryQualityMetricsStore();
    }

    private ProcessingRunService service(StubContentSource source) {
        // model "b" has no answer for T3; neither model answers T4
        StubModelAdapter a = StubModelAdapter.table("a", Map.of(
            T1, new double[]{0.8, 0.9},
            T2, new double[]{-0.2, 0.4},
            T3, new double[]{0.0, 0.3}));
        StubModelAdapter b = StubModelAdapter.table("b", Map.of(
            T1, new double[]{0.6, 0.5},
            T2, new double[]{0.1, 0.6}));
        ModelDispatchService dispatch = new ModelDispatchService(List.of(a, b),
            new DispatchSettings(Duration.ofSeconds(2), Map.of()));
        MentionScoringService scoring = new MentionScoringService(dispatch,
            new ConfidenceWeightedFusionStrategy(FusionSettings.defaults()), mentionStore, CLOCK);
        return new ProcessingRunService(source, scoring, qualityStore, ValidatorSettings.defaults(),
            CATALOG, CALCULATOR, new ScoringFlowLogger(), CLOCK, 4);
    }

    private static RawMention raw(String id, String text) {
        return RawMention.of(id, PUB, text, NOW.minus(Duration.ofHours(2)));
    }

    private static StubContentSource mixedBatch() {
        return StubContentSource.of(
            raw("p1", T1),
            raw("p2", T2),
            raw("p3", T3),
            raw("p4", T4),
            raw("dup", "great beer at the HALIFAX pub tonight"),
            raw("spam", "Click here for a promo code at the Halifax Pub"),
            raw("short", "meh"));
    }

    @Test
    @DisplayName("accepted mentions are fused and persisted with the expected scores")
    void fusedScoresPersisted() {
        StepVerifier.create(service(mixedBatch()).run(BatchSelector.of("reddit"), ProcessingMode.BASIC, "job-1", p -> {}))
            .expectNextCount(1)
            .verifyComplete();

        assertEquals(3, mentionStore.size());
        Mention m1 = mentionStore.get("p1");
        assertEquals(51.0 / 70.0, m1.sentiment().score(), 1e-9);
        assertEquals(SentimentLabel.POSITIVE, m1.label());
        assertEquals(PUB, m1.entityName());
        assertTrue(m1.topicTags().contains("beer"));
        assertEquals(-0.02, mentionStore.get("p2").sentiment().score(), 1e-9);
        assertEquals(0.0, mentionStore.get("p3").sentiment().score(), 1e-9);
        assertTrue(mentionStore.get("p3").sentiment().confidence() <= 0.7);
        assertNull(mentionStore.get("p4"));
    }

    @Test
    @DisplayName("summary and snapshot count verdicts, scored mentions and exhausted ensembles")
    void snapshotCounts() {
        StepVerifier.create(service(mixedBatch()).run(BatchSelector.of("reddit"), ProcessingMode.BASIC, "job-1", p -> {}))
            .assertNext(summary -> {
                assertEquals(7, summary.totalProcessed());
                assertEquals(4, summary.validCount());
                assertEquals(3, summary.invalidCount());
                assertEquals(3, summary.mentionsScored());
                assertEquals(1, summary.scoringErrors());
                assertEquals(1, summary.uniqueEntities());
            })
            .verifyComplete();

        List<QualityMetricsSnapshot> snapshots = qualityStore.all();
        assertEquals(1, snapshots.size());
        QualityMetricsSnapshot s = snapshots.get(0);
        assertEquals(NOW, s.processedAt());
        assertEquals(1, s.spamFilteredCount());
        assertEquals(1, s.duplicateFilteredCount());
        assertEquals(1, s.scoringErrorCount());
        assertEquals(CALCULATOR.score(7, 4.0 / 7.0, s.averageConfidence(), 1.0 / 7.0), s.qualityScore(), 1e-12);
    }

    @Test
    @DisplayName("progress is reported once per accepted mention, up to 100")
    void progressReported() {
        List<Integer> progress = new CopyOnWriteArrayList<>();

        StepVerifier.create(service(mixedBatch()).run(BatchSelector.of("reddit"), ProcessingMode.BASIC, "job-1", progress::add))
            .expectNextCount(1)
            .verifyComplete();

        assertEquals(List.of(25, 50, 75, 100), progress.stream().sorted().toList());
    }

    @Test
    @DisplayName("re-running the same batch replaces mentions instead of duplicating them")
    void rerunIsIdempotent() {
        ProcessingRunService service = service(mixedBatch());

        service.run(BatchSelector.of("reddit"), ProcessingMode.BASIC, "job-1", p -> {}).block();
        service.run(BatchSelector.of("reddit"), ProcessingMode.BASIC, "job-2", p -> {}).block();

        assertEquals(3, mentionStore.size());
        assertEquals(2, qualityStore.all().size());
    }

    @Nested
    @DisplayName("edge cases")
    class EdgeCases {

        @Test
        @DisplayName("empty batch completes with a zero quality score")
        void emptyBatch() {
            StepVerifier.create(service(StubContentSource.of()).run(BatchSelector.of("reddit"), ProcessingMode.BASIC, "job-1", p -> {}))
                .assertNext(summary -> {
                    assertEquals(0, summary.totalProcessed());
                    assertEquals(0.0, summary.qualityScore(), 1e-12);
                })
                .verifyComplete();
            assertEquals(1, qualityStore.all().size());
        }

        @Test
        @DisplayName("content source failure fails the run and writes no snapshot")
        void sourceFailure() {
            StepVerifier.create(service(StubContentSource.failing(new IllegalStateException("source down")))
                    .run(BatchSelector.of("reddit"), ProcessingMode.BASIC, "job-1", p -> {}))
                .expectErrorMessage("source down")
                .verify();
            assertTrue(qualityStore.all().isEmpty());
        }

        @Test
        @DisplayName("storage failure is not an exhausted ensemble and fails the run")
        void storeFailure() {
            mentionStore.failWith(new IllegalStateException("db down"));

            StepVerifier.create(service(mixedBatch()).run(BatchSelector.of("reddit"), ProcessingMode.BASIC, "job-1", p -> {}))
                .expectErrorMessage("db down")
                .verify();
            assertTrue(qualityStore.all().isEmpty());
        }
    }
}
