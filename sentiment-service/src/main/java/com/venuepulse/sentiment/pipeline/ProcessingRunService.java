package com.venuepulse.sentiment.pipeline;

import com.venuepulse.common.exception.EnsembleExhaustedException;
import com.venuepulse.common.model.RawMention;
import com.venuepulse.common.quality.QualityRunTally;
import com.venuepulse.common.quality.QualityScoreCalculator;
import com.venuepulse.common.quality.QualityValidator;
import com.venuepulse.common.quality.ValidationVerdict;
import com.venuepulse.common.quality.ValidatorSettings;
import com.venuepulse.common.text.EntityCatalog;
import com.venuepulse.common.trace.TraceContextUtil;
import com.venuepulse.sentiment.job.ProcessingMode;
import com.venuepulse.sentiment.source.BatchSelector;
import com.venuepulse.sentiment.source.ContentSource;
import com.venuepulse.sentiment.store.QualityMetricsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * Executes one processing run end to end:
 * <ol>
 *   <li>fetch raw items from the {@link ContentSource}</li>
 *   <li>validate them in source order with a fresh {@link QualityValidator}, so the duplicate
 *       window is the same on every run of the same input</li>
 *   <li>score accepted mentions in parallel, up to {@code sentiment.pipeline.concurrency}</li>
 *   <li>write one {@link com.venuepulse.common.model.QualityMetricsSnapshot}</li>
 * </ol>
 * A mention whose ensemble is exhausted is skipped and counted; any other error fails the run.
 * Mentions persisted before the failure stay persisted.
 */
@Service
public class ProcessingRunService {

    private static final Logger log = LoggerFactory.getLogger(ProcessingRunService.class);

    private final ContentSource contentSource;
    private final MentionScoringService scoringService;
    private final QualityMetricsStore qualityStore;
    private final ValidatorSettings validatorSettings;
    private final EntityCatalog catalog;
    private final QualityScoreCalculator qualityCalculator;
    private final ScoringFlowLogger flowLogger;
    private final Clock clock;
    private final int concurrency;

    public ProcessingRunService(ContentSource contentSource,
                                MentionScoringService scoringService,
                                QualityMetricsStore qualityStore,
                                ValidatorSettings validatorSettings,
                                EntityCatalog catalog,
                                QualityScoreCalculator qualityCalculator,
                                ScoringFlowLogger flowLogger,
                                Clock clock,
                                @Value("${sentiment.pipeline.concurrency:8}") int concurrency) {
        this.contentSource     = contentSource;
        this.scoringService    = scoringService;
        this.qualityStore      = qualityStore;
        this.validatorSettings = validatorSettings;
        this.catalog           = catalog;
        this.qualityCalculator = qualityCalculator;
        this.flowLogger        = flowLogger;
        this.clock             = clock;
        this.concurrency       = Math.max(1, concurrency);
    }

    /**
     * @param progress receives the share of accepted mentions handled so far, 0..100
     */
    public Mono<RunSummary> run(BatchSelector selector, ProcessingMode mode, String traceId, IntConsumer progress) {
        QualityRunTally tally = new QualityRunTally();

        Mono<RunSummary> pipeline = contentSource.fetch(selector)
            .collectList()
            .doOnEach(flowLogger.stage(ScoringFlowLogger.BATCH_FETCHED))
            .map(raws -> validate(raws, tally))
            .doOnEach(flowLogger.stage(ScoringFlowLogger.BATCH_VALIDATED))
            .flatMap(accepted -> scoreAll(accepted, mode, tally, traceId, progress))
            .then(Mono.defer(() -> qualityStore.save(tally.snapshot(clock.instant(), qualityCalculator))))
            .doOnEach(flowLogger.stage(ScoringFlowLogger.SNAPSHOT_PERSISTED))
            .map(RunSummary::of)
            .doOnSuccess(summary -> log.info(
                "Processing run complete. source={} mode={} total={} valid={} scored={} scoringErrors={} qualityScore={}",
                selector.source(), mode, summary.totalProcessed(), summary.validCount(),
                summary.mentionsScored(), summary.scoringErrors(), summary.qualityScore()));

        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    private List<Accepted> validate(List<RawMention> raws, QualityRunTally tally) {
        QualityValidator validator = new QualityValidator(validatorSettings, catalog);
        List<Accepted> accepted = new ArrayList<>();
        for (RawMention raw : raws) {
            ValidationVerdict verdict = validator.validate(raw);
            tally.recordVerdict(verdict);
            if (verdict.accepted()) {
                accepted.add(new Accepted(raw, verdict.entityName()));
            } else {
                log.debug("Mention rejected. sourceId={} reasons={}", raw.sourceId(), verdict.reasons());
            }
        }
        log.info("Batch validated. received={} accepted={}", raws.size(), accepted.size());
        return accepted;
    }

    private Mono<Void> scoreAll(List<Accepted> accepted, ProcessingMode mode, QualityRunTally tally,
                                String traceId, IntConsumer progress) {
        int total = accepted.size();
        AtomicInteger done = new AtomicInteger();
        return Flux.fromIterable(accepted)
            .flatMap(a -> scoringService.score(a.raw(), a.entityName(), mode)
                .doOnNext(m -> {
                    tally.recordScored(m.entityName(), m.sentiment().confidence());
                    flowLogger.logWithTraceId(ScoringFlowLogger.MENTION_SCORED, traceId,
                        "sourceId=" + m.sourceId() + " entity=" + m.entityName() + " score=" + m.sentiment().score());
                })
                .onErrorResume(EnsembleExhaustedException.class, e -> {
                    tally.recordScoringError();
                    flowLogger.logWithTraceId(ScoringFlowLogger.SCORING_EXHAUSTED, traceId,
                        "sourceId=" + a.raw().sourceId() + " failedModels=" + e.getFailedModels());
                    return Mono.empty();
                })
                .doOnTerminate(() -> progress.accept(done.incrementAndGet() * 100 / total)),
                concurrency)
            .then();
    }

    private record Accepted(RawMention raw, String entityName) {}
}
