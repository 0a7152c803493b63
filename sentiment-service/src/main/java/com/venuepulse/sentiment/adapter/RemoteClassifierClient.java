package com.venuepulse.sentiment.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.venuepulse.common.exception.ModelInvocationException;
import com.venuepulse.common.exception.ModelUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Calls a text-classification inference endpoint and returns {@code label → probability}.
 *
 * <p>Request body: {@code {"inputs": "<text>"}}. The response may be a flat list
 * {@code [{"label": .., "score": ..}, ...]} or that list wrapped once more, as returned for
 * "all scores" pipelines. Input is cut to {@value #MAX_INPUT_CHARS} characters.
 */
public class RemoteClassifierClient {

    private static final Logger log = LoggerFactory.getLogger(RemoteClassifierClient.class);

    static final int MAX_INPUT_CHARS = 512;

    private final WebClient webClient;
    private final String modelName;
    private final String endpointUrl;

    public RemoteClassifierClient(WebClient webClient, String modelName, String endpointUrl) {
        this.webClient   = webClient;
        this.modelName   = modelName;
        this.endpointUrl = endpointUrl;
    }

    public boolean configured() {
        return endpointUrl != null && !endpointUrl.isBlank();
    }

    public Mono<Map<String, Double>> classify(String text) {
        if (!configured()) {
            return Mono.error(new ModelUnavailableException(modelName, "no endpoint configured"));
        }
        String input = text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;
        return webClient.post()
            .uri(endpointUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("inputs", input))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(this::parseLabels)
            .doOnSuccess(labels -> log.debug("Remote model responded. model={} labels={}", modelName, labels))
            .onErrorMap(e -> !(e instanceof ModelInvocationException),
                e -> new ModelInvocationException(modelName, "remote call failed: " + e.getMessage(), e));
    }

    Map<String, Double> parseLabels(JsonNode body) {
        JsonNode list = body;
        if (list.isArray() && list.size() > 0 && list.get(0).isArray()) {
            list = list.get(0);
        }
        if (!list.isArray() || list.isEmpty()) {
            throw new ModelInvocationException(modelName, "unexpected response shape");
        }
        Map<String, Double> labels = new LinkedHashMap<>();
        Iterator<JsonNode> it = list.elements();
        while (it.hasNext()) {
            JsonNode entry = it.next();
            JsonNode label = entry.get("label");
            JsonNode score = entry.get("score");
            if (label == null || score == null || !score.isNumber()) {
                throw new ModelInvocationException(modelName, "entry without label/score: " + entry);
            }
            double p = score.asDouble();
            if (!Double.isFinite(p) || p < 0.0 || p > 1.0) {
                throw new ModelInvocationException(modelName, "probability out of range: " + p);
            }
            labels.put(label.asText().toLowerCase(Locale.ROOT), p);
        }
        return labels;
    }
}
