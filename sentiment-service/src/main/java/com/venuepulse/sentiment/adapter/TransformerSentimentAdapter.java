package com.venuepulse.sentiment.adapter;

import com.venuepulse.common.exception.ModelInvocationException;
import com.venuepulse.common.fusion.FusionSettings;
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
 * Remote three-class sentiment model.
 *
 * <pre>
 *   polarity   = (positive − negative) × (1 − neutral)
 *   confidence = max(positive, negative, neutral)
 * </pre>
 * Labels are matched by substring ({@code "negative"}, {@code "positive"}, anything else is
 * neutral); the numbered form {@code LABEL_0/1/2} is read as negative/neutral/positive.
 */
@Component
public class TransformerSentimentAdapter implements ModelAdapter {

    private final RemoteClassifierClient client;

    @Autowired
    public TransformerSentimentAdapter(
            @Qualifier("modelWebClient") WebClient modelWebClient,
            @Value("${sentiment.models.transformer.url:}") String endpointUrl) {
        this(new RemoteClassifierClient(modelWebClient, FusionSettings.TRANSFORMER, endpointUrl));
    }

    TransformerSentimentAdapter(RemoteClassifierClient client) {
        this.client = client;
    }

    @Override
    public String modelName() {
        return FusionSettings.TRANSFORMER;
    }

    @Override
    public ModelRole role() {
        return ModelRole.SENTIMENT;
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
        double positive = 0.0;
        double negative = 0.0;
        double neutral  = 0.0;
        for (Map.Entry<String, Double> e : labels.entrySet()) {
            switch (classOf(e.getKey())) {
                case "positive" -> positive = e.getValue();
                case "negative" -> negative = e.getValue();
                default         -> neutral  = e.getValue();
            }
        }
        if (positive + negative + neutral == 0.0) {
            throw new ModelInvocationException(modelName(), "no class probabilities in response");
        }
        double polarity   = (positive - negative) * (1.0 - neutral);
        double confidence = Math.max(positive, Math.max(negative, neutral));
        return ModelOutcome.sentiment(modelName(), polarity, confidence);
    }

    private static String classOf(String label) {
        if (label.contains("negative") || label.equals("label_0")) return "negative";
        if (label.contains("positive") || label.equals("label_2")) return "positive";
        return "neutral";
    }
}
