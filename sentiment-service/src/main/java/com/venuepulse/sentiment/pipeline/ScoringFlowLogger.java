package com.venuepulse.sentiment.pipeline;

import com.venuepulse.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs the stages of a processing run. Pure side effects; the traceId is the job id.
 *
 * <ol>
 *   <li>{@link #BATCH_FETCHED}: raw items received from the content source</li>
 *   <li>{@link #BATCH_VALIDATED}: validator verdicts counted</li>
 *   <li>{@link #MENTION_SCORED}: a mention was fused and persisted</li>
 *   <li>{@link #SCORING_EXHAUSTED}: no sentiment model succeeded for a mention</li>
 *   <li>{@link #SNAPSHOT_PERSISTED}: quality snapshot written, run complete</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(ScoringFlowLogger.BATCH_FETCHED))
 * </pre>
 */
@Component
public class ScoringFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(ScoringFlowLogger.class);

    public static final String BATCH_FETCHED      = "BATCH_FETCHED";
    public static final String BATCH_VALIDATED    = "BATCH_VALIDATED";
    public static final String MENTION_SCORED     = "MENTION_SCORED";
    public static final String SCORING_EXHAUSTED  = "SCORING_EXHAUSTED";
    public static final String SNAPSHOT_PERSISTED = "SNAPSHOT_PERSISTED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on every {@code onNext},
     * reading the traceId from the Reactor Context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[ScoringFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /** For handlers that already hold the traceId. */
    public void logWithTraceId(String stageName, String traceId, String detail) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[ScoringFlow] stage={} traceId={} {}", stageName, traceId, detail)
        );
    }
}
