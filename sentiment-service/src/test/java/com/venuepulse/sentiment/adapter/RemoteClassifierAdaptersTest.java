package com.venuepulse.sentiment.adapter;

import com.venuepulse.common.exception.ModelInvocationException;
import com.venuepulse.common.exception.ModelUnavailableException;
import com.venuepulse.common.model.ModelRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RemoteClassifierAdaptersTest {

    private static final String URL = "http://models.test/classify";

    /** WebClient whose every exchange answers with the given status and JSON body. */
    private static WebClient stub(HttpStatus status, String json, AtomicInteger calls) {
        return WebClient.builder()
            .exchangeFunction(request -> {
                calls.incrementAndGet();
                return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(json)
                    .build());
            })
            .build();
    }

    private static WebClient stub(String json) {
        return stub(HttpStatus.OK, json, new AtomicInteger());
    }

    @Nested
    @DisplayName("transformer sentiment")
    class Transformer {

        @Test
        @DisplayName("polarity = (p − n) × (1 − neutral), confidence = top class")
        void nestedResponse() {
            TransformerSentimentAdapter adapter = new TransformerSentimentAdapter(stub(
                "[[{\"label\":\"positive\",\"score\":0.7},{\"label\":\"neutral\",\"score\":0.2},"
                    + "{\"label\":\"negative\",\"score\":0.1}]]"), URL);

            StepVerifier.create(adapter.score("Lovely pints"))
                .assertNext(outcome -> {
                    assertEquals(0.48, outcome.score(), 1e-9);
                    assertEquals(0.7, outcome.confidence(), 1e-9);
                    assertEquals(ModelRole.SENTIMENT, outcome.role());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("numbered labels read as negative / neutral / positive")
        void numberedLabels() {
            TransformerSentimentAdapter adapter = new TransformerSentimentAdapter(stub(
                "[{\"label\":\"LABEL_0\",\"score\":0.6},{\"label\":\"LABEL_1\",\"score\":0.3},"
                    + "{\"label\":\"LABEL_2\",\"score\":0.1}]"), URL);

            StepVerifier.create(adapter.score("Warm beer"))
                .assertNext(outcome -> {
                    assertEquals(-0.35, outcome.score(), 1e-9);
                    assertEquals(0.6, outcome.confidence(), 1e-9);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("no endpoint → unavailable, nothing sent")
        void unconfigured() {
            AtomicInteger calls = new AtomicInteger();
            TransformerSentimentAdapter adapter =
                new TransformerSentimentAdapter(stub(HttpStatus.OK, "[]", calls), "");

            StepVerifier.create(adapter.score("anything"))
                .expectError(ModelUnavailableException.class)
                .verify();
            assertEquals(0, calls.get());
            assertFalse(adapter.local());
        }

        @Test
        @DisplayName("server error surfaces as a model invocation failure")
        void serverError() {
            TransformerSentimentAdapter adapter = new TransformerSentimentAdapter(
                stub(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"loading\"}", new AtomicInteger()), URL);

            StepVerifier.create(adapter.score("anything"))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(ModelInvocationException.class, e);
                    assertEquals("transformer", ((ModelInvocationException) e).getModelName());
                })
                .verify();
        }

        @Test
        @DisplayName("probability outside [0, 1] is rejected")
        void outOfRangeProbability() {
            TransformerSentimentAdapter adapter = new TransformerSentimentAdapter(
                stub("[{\"label\":\"positive\",\"score\":1.4}]"), URL);

            StepVerifier.create(adapter.score("anything"))
                .expectError(ModelInvocationException.class)
                .verify();
        }

        @Test
        @DisplayName("unexpected shape is rejected")
        void unexpectedShape() {
            TransformerSentimentAdapter adapter = new TransformerSentimentAdapter(
                stub("{\"label\":\"positive\"}"), URL);

            StepVerifier.create(adapter.score("anything"))
                .expectError(ModelInvocationException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("emotion classifier")
    class Emotion {

        @Test
        @DisplayName("labels become the emotion profile, confidence is the top probability")
        void emotions() {
            EmotionClassifierAdapter adapter = new EmotionClassifierAdapter(stub(
                "[[{\"label\":\"Joy\",\"score\":0.8},{\"label\":\"anger\",\"score\":0.15}]]"), URL);

            StepVerifier.create(adapter.score("Best night out"))
                .assertNext(outcome -> {
                    assertEquals(ModelRole.EMOTION, outcome.role());
                    assertEquals(0.8, outcome.confidence(), 1e-9);
                    assertEquals(Map.of("joy", 0.8, "anger", 0.15), outcome.emotions());
                })
                .verifyComplete();
        }

        @Test
        void emptyLabelsRejected() {
            EmotionClassifierAdapter adapter = new EmotionClassifierAdapter(
                new RemoteClassifierClient(WebClient.create(), EmotionClassifierAdapter.MODEL_NAME, URL));

            assertThrows(ModelInvocationException.class, () -> adapter.toOutcome(Map.of()));
        }
    }
}
