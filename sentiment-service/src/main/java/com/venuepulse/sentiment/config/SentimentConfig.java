package com.venuepulse.sentiment.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.venuepulse.common.analytics.ComparisonEngine;
import com.venuepulse.common.analytics.TrendAggregator;
import com.venuepulse.common.fusion.ConfidenceWeightedFusionStrategy;
import com.venuepulse.common.fusion.FusionScorer;
import com.venuepulse.common.fusion.FusionSettings;
import com.venuepulse.common.quality.QualityScoreCalculator;
import com.venuepulse.common.quality.QualityWeights;
import com.venuepulse.common.quality.ValidatorSettings;
import com.venuepulse.common.text.EntityCatalog;
import com.venuepulse.sentiment.dispatch.DispatchSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns {@code sentiment.*} properties into the immutable settings records the engines take.
 * Map-valued properties are SpEL inline maps, e.g.
 * {@code "{'lexicon': 0.3, 'transformer': 0.5}"}.
 */
@Configuration
public class SentimentConfig {

    private static final Logger log = LoggerFactory.getLogger(SentimentConfig.class);

    @Bean
    public FusionSettings fusionSettings(
            @Value("#{${sentiment.fusion.reliability:{'lexicon': 0.3, 'hospitality': 0.2, 'transformer': 0.5}}}")
            Map<String, Double> reliability,
            @Value("${sentiment.fusion.default-reliability:0.25}")          double defaultReliability,
            @Value("${sentiment.fusion.single-model-confidence-cap:0.7}")   double singleModelCap,
            @Value("${sentiment.fusion.high-confidence-threshold:0.8}")     double highConfidence,
            @Value("${sentiment.fusion.max-variance:1.0}")                  double maxVariance) {
        FusionSettings settings = new FusionSettings(
            reliability, defaultReliability, singleModelCap, highConfidence, maxVariance);
        log.info("Fusion settings loaded. reliability={} singleModelCap={} highConfidence={}",
            settings.reliabilityWeights(), singleModelCap, highConfidence);
        return settings;
    }

    @Bean
    public FusionScorer fusionScorer(FusionSettings fusionSettings) {
        return new ConfidenceWeightedFusionStrategy(fusionSettings);
    }

    @Bean
    public ValidatorSettings validatorSettings(
            @Value("${sentiment.validator.min-length:10}")             int minLength,
            @Value("${sentiment.validator.max-length:10000}")          int maxLength,
            @Value("${sentiment.validator.spam-keyword-threshold:2}")  int spamKeywordThreshold,
            @Value("${sentiment.validator.uppercase-ratio-limit:0.5}") double uppercaseRatioLimit,
            @Value("${sentiment.validator.uppercase-min-length:10}")   int uppercaseMinLength,
            @Value("${sentiment.validator.repeated-character-run:5}")  int repeatedCharacterRun,
            @Value("${sentiment.validator.duplicate-window:500}")      int duplicateWindow,
            @Value("${sentiment.validator.relevance-floor:0.1}")       double relevanceFloor) {
        return new ValidatorSettings(minLength, maxLength, ValidatorSettings.DEFAULT_SPAM_KEYWORDS,
            spamKeywordThreshold, uppercaseRatioLimit, uppercaseMinLength, repeatedCharacterRun,
            duplicateWindow, relevanceFloor, ValidatorSettings.DEFAULT_DOMAIN_KEYWORDS,
            ValidatorSettings.DEFAULT_DELETED_PLACEHOLDERS);
    }

    @Bean
    public QualityScoreCalculator qualityScoreCalculator(
            @Value("${sentiment.quality.acceptance-weight:0.6}") double acceptanceWeight,
            @Value("${sentiment.quality.confidence-weight:0.4}") double confidenceWeight,
            @Value("${sentiment.quality.spam-penalty:0.2}")      double spamPenalty) {
        return new QualityScoreCalculator(new QualityWeights(acceptanceWeight, confidenceWeight, spamPenalty));
    }

    /** Values are {@code |}-separated alias lists. */
    @Bean
    public EntityCatalog entityCatalog(@Value("#{${sentiment.catalog:{:}}}") Map<String, String> catalog) {
        Map<String, List<String>> aliases = new LinkedHashMap<>();
        catalog.forEach((name, aliasList) -> aliases.put(name,
            aliasList == null || aliasList.isBlank()
                ? List.of()
                : Arrays.stream(aliasList.split("\\|")).map(String::trim).filter(a -> !a.isEmpty()).toList()));
        log.info("Entity catalogue loaded. entities={}", aliases.size());
        return new EntityCatalog(aliases);
    }

    @Bean
    public DispatchSettings dispatchSettings(
            @Value("${sentiment.models.default-timeout-ms:2000}") long defaultTimeoutMs,
            @Value("#{${sentiment.models.timeouts:{:}}}")         Map<String, Long> timeoutsMs) {
        Map<String, Duration> perModel = new LinkedHashMap<>();
        timeoutsMs.forEach((model, ms) -> perModel.put(model, Duration.ofMillis(ms)));
        return new DispatchSettings(Duration.ofMillis(defaultTimeoutMs), perModel);
    }

    @Bean
    public TrendAggregator trendAggregator() {
        return new TrendAggregator();
    }

    @Bean
    public ComparisonEngine comparisonEngine() {
        return new ComparisonEngine();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs processing jobs off the caller's thread. */
    @Bean(destroyMethod = "dispose")
    public Scheduler jobScheduler() {
        return Schedulers.newBoundedElastic(4, 64, "processing-job");
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
