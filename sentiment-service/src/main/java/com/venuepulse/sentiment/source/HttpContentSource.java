package com.venuepulse.sentiment.source;

import com.venuepulse.common.model.RawMention;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

/**
 * Pulls raw items from the collector service:
 * {@code GET /api/v1/mentions?source=..&since=..&until=..&limit=..} answering a JSON array
 * of raw mentions.
 */
@Component
public class HttpContentSource implements ContentSource {

    private static final Logger log = LoggerFactory.getLogger(HttpContentSource.class);

    private final WebClient webClient;

    public HttpContentSource(@Qualifier("contentSourceWebClient") WebClient contentSourceWebClient) {
        this.webClient = contentSourceWebClient;
    }

    @Override
    public Flux<RawMention> fetch(BatchSelector selector) {
        log.info("Fetching raw mentions. source={} since={} until={} limit={}",
            selector.source(), selector.since(), selector.until(), selector.limit());
        return webClient.get()
            .uri(uri -> {
                uri.path("/api/v1/mentions")
                   .queryParam("source", selector.source())
                   .queryParam("limit", selector.limit());
                if (selector.since() != null) uri.queryParam("since", selector.since().toString());
                if (selector.until() != null) uri.queryParam("until", selector.until().toString());
                return uri.build();
            })
            .retrieve()
            .bodyToFlux(RawMention.class)
            .take(selector.limit())
            .doOnComplete(() -> log.info("Raw mentions fetched. source={}", selector.source()))
            .doOnError(e -> log.error("Content source fetch failed. source={}", selector.source(), e));
    }
}
