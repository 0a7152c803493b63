package com.venuepulse.sentiment.dispatch;

import com.venuepulse.common.exception.ModelUnavailableException;
import com.venuepulse.common.model.FailureKind;
import com.venuepulse.common.model.ModelOutcome;
import com.venuepulse.common.model.ModelRole;
import com.venuepulse.sentiment.job.ProcessingMode;
import com.venuepulse.sentiment.support.StubModelAdapter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ModelDispatchServiceTest {

    private static final DispatchSettings FAST =
        new DispatchSettings(Duration.ofSeconds(2), Map.of("slow", Duration.ofMillis(100)));

    private static List<ModelOutcome> sorted(List<ModelOutcome> outcomes) {
        return outcomes.stream().sorted(Comparator.comparing(ModelOutcome::modelName)).toList();
    }

    @Test
    @DisplayName("one outcome per selected adapter")
    void collectsAll() {
        ModelDispatchService service = new ModelDispatchService(List.of(
            StubModelAdapter.fixed("a", 0.5, 0.9),
            StubModelAdapter.fixed("b", -0.2, 0.4)), FAST);

        StepVerifier.create(service.dispatchAll("text", ProcessingMode.ADVANCED).map(ModelDispatchServiceTest::sorted))
            .assertNext(outcomes -> {
                assertEquals(2, outcomes.size());
                assertTrue(outcomes.stream().allMatch(ModelOutcome::succeeded));
                assertEquals(0.5, ((ModelOutcome.Scored) outcomes.get(0)).score(), 1e-9);
            })
            .verifyComplete();
    }

    @Nested
    @DisplayName("failure isolation")
    class Failures {

        @Test
        @DisplayName("a model that never answers times out without holding up the others")
        void timeout() {
            StubModelAdapter slow = new StubModelAdapter("slow", ModelRole.SENTIMENT, true, text -> Mono.never());
            ModelDispatchService service = new ModelDispatchService(List.of(
                slow, StubModelAdapter.fixed("fast", 0.3, 0.6)), FAST);

            StepVerifier.create(service.dispatchAll("text", ProcessingMode.BASIC).map(ModelDispatchServiceTest::sorted))
                .assertNext(outcomes -> {
                    assertTrue(outcomes.get(0).succeeded());
                    ModelOutcome.Failed failed = (ModelOutcome.Failed) outcomes.get(1);
                    assertEquals("slow", failed.modelName());
                    assertEquals(FailureKind.MODEL_TIMEOUT, failed.kind());
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("errors and unavailability map to typed failures")
        void errorKinds() {
            ModelDispatchService service = new ModelDispatchService(List.of(
                StubModelAdapter.failing("broken", new IllegalStateException("boom")),
                StubModelAdapter.failing("offline", new ModelUnavailableException("offline", "no endpoint")),
                StubModelAdapter.fixed("ok", 0.1, 0.5)), FAST);

            StepVerifier.create(service.dispatchAll("text", ProcessingMode.ADVANCED).map(ModelDispatchServiceTest::sorted))
                .assertNext(outcomes -> {
                    assertEquals(FailureKind.MODEL_ERROR, ((ModelOutcome.Failed) outcomes.get(0)).kind());
                    assertEquals(FailureKind.MODEL_UNAVAILABLE, ((ModelOutcome.Failed) outcomes.get(1)).kind());
                    assertTrue(outcomes.get(2).succeeded());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("an adapter that completes empty is a model error")
        void emptyIsError() {
            StubModelAdapter silent = new StubModelAdapter("silent", ModelRole.SENTIMENT, true, text -> Mono.empty());
            ModelDispatchService service = new ModelDispatchService(List.of(silent), FAST);

            StepVerifier.create(service.dispatchAll("text", ProcessingMode.BASIC))
                .assertNext(outcomes -> assertEquals(FailureKind.MODEL_ERROR,
                    ((ModelOutcome.Failed) outcomes.get(0)).kind()))
                .verifyComplete();
        }

        @Test
        @DisplayName("out-of-range output thrown while building the outcome is a model error")
        void invalidOutput() {
            StubModelAdapter invalid = new StubModelAdapter("invalid", ModelRole.SENTIMENT, true,
                text -> Mono.fromCallable(() -> ModelOutcome.sentiment("invalid", 1.7, 0.5)));
            ModelDispatchService service = new ModelDispatchService(List.of(invalid), FAST);

            StepVerifier.create(service.dispatchAll("text", ProcessingMode.BASIC))
                .assertNext(outcomes -> assertFalse(outcomes.get(0).succeeded()))
                .verifyComplete();
        }
    }

    @Test
    @DisplayName("basic mode skips remote adapters")
    void basicModeSkipsRemote() {
        StubModelAdapter remote = new StubModelAdapter("remote", ModelRole.SENTIMENT, false,
            text -> Mono.just(ModelOutcome.sentiment("remote", 0.9, 0.9)));
        StubModelAdapter local = StubModelAdapter.fixed("local", 0.1, 0.2);
        ModelDispatchService service = new ModelDispatchService(List.of(remote, local), FAST);

        StepVerifier.create(service.dispatchAll("text", ProcessingMode.BASIC))
            .assertNext(outcomes -> {
                assertEquals(1, outcomes.size());
                assertEquals("local", outcomes.get(0).modelName());
            })
            .verifyComplete();
        assertEquals(0, remote.calls());
    }

    @Test
    void toFailureClassifiesTimeout() {
        ModelOutcome.Failed failed = ModelDispatchService.toFailure(
            "m", new TimeoutException(), Duration.ofMillis(250));

        assertEquals(FailureKind.MODEL_TIMEOUT, failed.kind());
        assertTrue(failed.detail().contains("250"));
    }
}
