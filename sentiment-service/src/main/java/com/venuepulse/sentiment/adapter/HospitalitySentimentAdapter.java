package com.venuepulse.sentiment.adapter;

import com.venuepulse.common.fusion.FusionSettings;
import com.venuepulse.common.model.ModelOutcome;
import com.venuepulse.common.model.ModelRole;
import com.venuepulse.common.text.TextNormalizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Venue-vocabulary scorer: {@code score = clamp(0.1 × (positive − negative), -1, 1)} where the
 * counts are distinct indicator words present in the text ("cozy", "attentive" versus
 * "overpriced", "soggy", ...). Confidence is {@code n / (n + 3)} over all indicators found.
 */
@Component
public class HospitalitySentimentAdapter implements ModelAdapter {

    static final double ADJUSTMENT_PER_INDICATOR = 0.1;

    private final Set<String> positiveIndicators;
    private final Set<String> negativeIndicators;

    public HospitalitySentimentAdapter(
            @Value("${sentiment.lexicon.hospitality-positive:classpath:lexicon/hospitality-positive.txt}") Resource positive,
            @Value("${sentiment.lexicon.hospitality-negative:classpath:lexicon/hospitality-negative.txt}") Resource negative) {
        this.positiveIndicators = WordListLoader.load(positive);
        this.negativeIndicators = WordListLoader.load(negative);
    }

    @Override
    public String modelName() {
        return FusionSettings.HOSPITALITY;
    }

    @Override
    public ModelRole role() {
        return ModelRole.SENTIMENT;
    }

    @Override
    public boolean local() {
        return true;
    }

    @Override
    public Mono<ModelOutcome.Scored> score(String text) {
        return Mono.fromCallable(() -> evaluate(text));
    }

    ModelOutcome.Scored evaluate(String text) {
        String normalized = TextNormalizer.normalize(text);
        long positive = positiveIndicators.stream().filter(w -> TextNormalizer.containsPhrase(normalized, w)).count();
        long negative = negativeIndicators.stream().filter(w -> TextNormalizer.containsPhrase(normalized, w)).count();

        double score = Math.max(-1.0, Math.min(1.0, (positive - negative) * ADJUSTMENT_PER_INDICATOR));
        long found = positive + negative;
        double confidence = found / (found + 3.0);
        return ModelOutcome.sentiment(modelName(), score, confidence);
    }
}
