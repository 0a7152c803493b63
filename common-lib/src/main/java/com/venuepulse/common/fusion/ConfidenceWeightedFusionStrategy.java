package com.venuepulse.common.fusion;

import com.venuepulse.common.exception.EnsembleExhaustedException;
import com.venuepulse.common.model.EmotionProfile;
import com.venuepulse.common.model.ModelOutcome;
import com.venuepulse.common.model.ModelRole;
import com.venuepulse.common.model.SentimentResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Default {@link FusionScorer}.
 *
 * <h3>Score</h3>
 * <pre>
 *   fusedScore = Σ(score_i × confidence_i) / Σ(confidence_i)
 * </pre>
 * If every surviving model reports zero confidence, the reliability-weighted mean of the
 * scores is used instead.
 *
 * <h3>Confidence</h3>
 * <pre>
 *   meanConfidence     = Σ(reliability_i × confidence_i) / Σ(reliability_i)
 *   normalizedVariance = min(1, populationVariance(score_i) / maxVariance)
 *   fusedConfidence    = meanConfidence × (1 − normalizedVariance)
 * </pre>
 * Disagreement between models lowers the confidence even when each model is sure of itself.
 *
 * <h3>Single surviving model</h3>
 * Score is taken as is; confidence is capped at
 * {@link FusionSettings#singleModelConfidenceCap()}, which sits below the high-confidence
 * threshold.
 *
 * <h3>Emotions</h3>
 * Unweighted mean per emotion over the models that reported that emotion.
 *
 * <p>Outcomes are sorted by model name before any arithmetic, so the result does not depend on
 * the order adapters finished in. This class is stateless and thread-safe.
 */
public class ConfidenceWeightedFusionStrategy implements FusionScorer {

    private final FusionSettings settings;

    public ConfidenceWeightedFusionStrategy(FusionSettings settings) {
        this.settings = settings;
    }

    @Override
    public FusionResult fuse(List<ModelOutcome> outcomes) {
        List<ModelOutcome.Scored> scored = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (ModelOutcome outcome : outcomes) {
            outcome.fold(
                s -> scored.add(s),
                f -> failed.add(f.modelName())
            );
        }
        scored.sort(Comparator.comparing(ModelOutcome.Scored::modelName));
        failed.sort(Comparator.naturalOrder());

        List<ModelOutcome.Scored> sentiment = scored.stream()
            .filter(s -> s.role() == ModelRole.SENTIMENT)
            .toList();
        if (sentiment.isEmpty()) {
            throw new EnsembleExhaustedException(failed);
        }

        return new FusionResult(fuseSentiment(sentiment), fuseEmotions(scored), failed);
    }

    private SentimentResult fuseSentiment(List<ModelOutcome.Scored> models) {
        Map<String, Double> perModel = new TreeMap<>();
        for (ModelOutcome.Scored m : models) {
            perModel.put(m.modelName(), m.score());
        }

        if (models.size() == 1) {
            ModelOutcome.Scored only = models.get(0);
            double confidence = Math.min(only.confidence(), settings.singleModelConfidenceCap());
            return SentimentResult.of(clamp(only.score(), -1.0, 1.0), clamp(confidence, 0.0, 1.0), perModel);
        }

        double confidenceSum   = 0.0;
        double weightedScore   = 0.0;
        double reliabilitySum  = 0.0;
        double reliabilityConf = 0.0;
        double reliabilityScore = 0.0;
        double scoreSum        = 0.0;
        for (ModelOutcome.Scored m : models) {
            double reliability = settings.reliabilityOf(m.modelName());
            confidenceSum    += m.confidence();
            weightedScore    += m.score() * m.confidence();
            reliabilitySum   += reliability;
            reliabilityConf  += reliability * m.confidence();
            reliabilityScore += reliability * m.score();
            scoreSum         += m.score();
        }

        double fusedScore = confidenceSum > 0.0
            ? weightedScore / confidenceSum
            : reliabilityScore / reliabilitySum;

        double mean = scoreSum / models.size();
        double squaredDeviation = 0.0;
        for (ModelOutcome.Scored m : models) {
            double d = m.score() - mean;
            squaredDeviation += d * d;
        }
        double variance           = squaredDeviation / models.size();
        double normalizedVariance = Math.min(1.0, variance / settings.maxVariance());
        double meanConfidence     = reliabilityConf / reliabilitySum;
        double fusedConfidence    = meanConfidence * (1.0 - normalizedVariance);

        return SentimentResult.of(clamp(fusedScore, -1.0, 1.0), clamp(fusedConfidence, 0.0, 1.0), perModel);
    }

    private EmotionProfile fuseEmotions(List<ModelOutcome.Scored> models) {
        Map<String, double[]> totals = new TreeMap<>();
        for (ModelOutcome.Scored m : models) {
            m.emotions().forEach((emotion, intensity) -> {
                double[] acc = totals.computeIfAbsent(emotion.toLowerCase(Locale.ROOT), k -> new double[2]);
                acc[0] += intensity;
                acc[1] += 1.0;
            });
        }
        if (totals.isEmpty()) {
            return null;
        }
        Map<String, Double> averaged = new TreeMap<>();
        totals.forEach((emotion, acc) -> averaged.put(emotion, clamp(acc[0] / acc[1], 0.0, 1.0)));
        return new EmotionProfile(averaged);
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
