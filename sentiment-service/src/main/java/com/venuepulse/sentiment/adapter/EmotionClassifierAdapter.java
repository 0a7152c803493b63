package com.venuepulse.sentiment.adapter;

import com.venuepulse.common.exception.ModelInvocationException;
import com.venuepulse.common.model.ModelOutcome;
import com.venuepulse.common.model.ModelRole;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Remote emotion classifier. Contributes only to the emotion profile; its confidence is the
 * top label's probability.
 */
@Component
public class EmotionClassifierAdapter implements ModelAdapter {

    public static final String MODEL_NAME = "emotion";

    private final RemoteClassifierClient client;

    @Autowired
    public EmotionClassifierAdapter(
            @Qualifier("modelWebClient") WebClient modelWebClient,
            @Value("${sentiment.models.emotion.url:}") String endpointUrl) {
        this(new RemoteClassifierClient(modelWebClient, MODEL_NAME, endpointUrl));
    }

    EmotionClassifierAdapter(RemoteClassifierClient client) {
        this.client = client;
    }

    @Override
    public String modelName() {
        return MODEL_NAME;
    }

    @Override
    public ModelRole role() {
        return ModelRole.EMOTION;
    }

    @Override
    public boolean local() {
        return false;
    }

    @Override
    public Mono<ModelOutcome.Scored> score(String text) {
        return client.classify(text).map(this::toOutcome);
    }

    ModelOutcome.Scored toOutcome(Map<String, Double> labels) {
        double top = labels.values().stream().mapToDouble(Double::doubleValue).max()
            .orElseThrow(() -> new ModelInvocationException(MODEL_NAME, "empty emotion response"));
        return ModelOutcome.emotion(MODEL_NAME, top, labels);
    }
}
