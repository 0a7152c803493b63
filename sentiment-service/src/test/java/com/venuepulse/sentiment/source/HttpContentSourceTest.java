package com.venuepulse.sentiment.source;

import com.venuepulse.common.exception.InvalidParametersException;
import com.venuepulse.common.model.RawMention;
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

import java.net.URI;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpContentSourceTest {

    private static final String BODY = "["
        + "{\"source_id\":\"r1\",\"text\":\"Great wings at Stillwell\",\"entity_hint\":\"Stillwell\","
        + "\"created_at\":\"2024-03-10T20:00:00Z\",\"is_derived\":false,\"author_flagged_spammer\":false,\"extra\":1},"
        + "{\"source_id\":\"r2\",\"text\":\"Patio is open\",\"created_at\":\"2024-03-11T20:00:00Z\",\"is_derived\":true}"
        + "]";

    private final AtomicReference<URI> requested = new AtomicReference<>();

    private HttpContentSource source(HttpStatus status, String body) {
        WebClient client = WebClient.builder()
            .baseUrl("http://collector.test")
            .exchangeFunction(request -> {
                requested.set(request.url());
                return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
            })
            .build();
        return new HttpContentSource(client);
    }

    @Test
    @DisplayName("selector becomes query parameters; unknown fields are ignored")
    void fetches() {
        BatchSelector selector = new BatchSelector("reddit", Instant.parse("2024-03-01T00:00:00Z"), null, 50);

        StepVerifier.create(source(HttpStatus.OK, BODY).fetch(selector))
            .assertNext(raw -> {
                assertEquals("r1", raw.sourceId());
                assertEquals("Stillwell", raw.entityHint());
                assertEquals(Instant.parse("2024-03-10T20:00:00Z"), raw.createdAt());
            })
            .assertNext(raw -> {
                assertNull(raw.entityHint());
                assertTrue(raw.derived());
            })
            .verifyComplete();

        String query = requested.get().getQuery();
        assertEquals("/api/v1/mentions", requested.get().getPath());
        assertTrue(query.contains("source=reddit"));
        assertTrue(query.contains("limit=50"));
        assertTrue(query.contains("since=2024-03-01T00:00:00Z"));
        assertFalse(query.contains("until"));
    }

    @Test
    @DisplayName("never yields more than the selector limit")
    void respectsLimit() {
        StepVerifier.create(source(HttpStatus.OK, BODY).fetch(new BatchSelector("reddit", null, null, 1))
                .map(RawMention::sourceId))
            .expectNext("r1")
            .verifyComplete();
    }

    @Test
    void upstreamErrorPropagates() {
        StepVerifier.create(source(HttpStatus.BAD_GATEWAY, "[]").fetch(BatchSelector.of("reddit")))
            .expectError()
            .verify();
    }

    @Nested
    @DisplayName("BatchSelector")
    class Selector {

        @Test
        void rejectsInvalid() {
            assertThrows(InvalidParametersException.class, () -> BatchSelector.of(" "));
            assertThrows(InvalidParametersException.class, () -> new BatchSelector("reddit", null, null, 0));
            assertThrows(InvalidParametersException.class,
                () -> new BatchSelector("reddit", null, null, BatchSelector.MAX_LIMIT + 1));
            assertThrows(InvalidParametersException.class, () -> new BatchSelector("reddit",
                Instant.parse("2024-03-02T00:00:00Z"), Instant.parse("2024-03-01T00:00:00Z"), 10));
        }

        @Test
        @DisplayName("batch key normalizes the source name")
        void batchKey() {
            assertEquals("google-reviews", BatchSelector.of("  Google Reviews ").batchKey());
        }
    }
}
