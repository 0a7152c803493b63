package com.venuepulse.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries a run identifier through reactive pipelines.
 *
 * <p>Reactor Context holds the traceId inside a pipeline. MDC is written only for the
 * duration of a single log statement and cleared right after.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(runPipeline, jobId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    private TraceContextUtil() {}

    /**
     * Stores {@code traceId} in the Reactor Context. {@code contextWrite} applies upstream,
     * so call this at the end of pipeline assembly.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Returns {@code "unknown"} if no traceId was written; never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /**
     * Puts {@code traceId} into MDC while {@code logAction} runs, then removes it.
     * Use only around log statements.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
