package com.venuepulse.sentiment.adapter;

import com.venuepulse.common.fusion.FusionSettings;
import com.venuepulse.common.model.ModelOutcome;
import com.venuepulse.common.model.ModelRole;
import com.venuepulse.common.text.TextNormalizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;

/**
 * General-purpose polarity lexicon scorer.
 *
 * <p>Each lexicon word contributes ±1, or ±1.5 right after an intensifier. A negator within
 * the three preceding words flips the sign. The raw sum {@code x} is squashed into (-1, 1) as
 * {@code x / sqrt(x² + 15)}. Confidence grows with the number of sentiment-bearing words,
 * {@code hits / (hits + 2)}, and is 0 when the text has none.
 */
@Component
public class LexiconSentimentAdapter implements ModelAdapter {

    static final double NORMALIZATION_ALPHA = 15.0;
    static final double INTENSIFIER_BOOST   = 1.5;
    static final int    NEGATION_SCOPE      = 3;

    private static final Set<String> NEGATORS = Set.of(
        "not", "no", "never", "none", "nothing", "nobody", "neither", "nor", "hardly", "without",
        "t", "dont", "didnt", "isnt", "wasnt", "cant", "wont", "aint"
    );

    private static final Set<String> INTENSIFIERS = Set.of(
        "very", "really", "extremely", "super", "so", "incredibly", "absolutely", "totally"
    );

    private final Set<String> positiveWords;
    private final Set<String> negativeWords;

    public LexiconSentimentAdapter(
            @Value("${sentiment.lexicon.positive:classpath:lexicon/positive.txt}") Resource positive,
            @Value("${sentiment.lexicon.negative:classpath:lexicon/negative.txt}") Resource negative) {
        this.positiveWords = WordListLoader.load(positive);
        this.negativeWords = WordListLoader.load(negative);
    }

    @Override
    public String modelName() {
        return FusionSettings.LEXICON;
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
        List<String> words = TextNormalizer.words(TextNormalizer.normalize(text));
        double sum = 0.0;
        int hits = 0;
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i);
            int polarity = positiveWords.contains(word) ? 1 : negativeWords.contains(word) ? -1 : 0;
            if (polarity == 0) {
                continue;
            }
            double weight = i > 0 && INTENSIFIERS.contains(words.get(i - 1)) ? INTENSIFIER_BOOST : 1.0;
            if (negated(words, i)) {
                polarity = -polarity;
            }
            sum += polarity * weight;
            hits++;
        }
        double score = sum / Math.sqrt(sum * sum + NORMALIZATION_ALPHA);
        double confidence = hits == 0 ? 0.0 : hits / (hits + 2.0);
        return ModelOutcome.sentiment(modelName(), score, confidence);
    }

    private static boolean negated(List<String> words, int index) {
        for (int j = Math.max(0, index - NEGATION_SCOPE); j < index; j++) {
            if (NEGATORS.contains(words.get(j))) {
                return true;
            }
        }
        return false;
    }
}
