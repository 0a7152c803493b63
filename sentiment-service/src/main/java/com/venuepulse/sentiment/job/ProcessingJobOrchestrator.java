package com.venuepulse.sentiment.job;

import com.venuepulse.common.exception.BatchAlreadyRunningException;
import com.venuepulse.common.exception.JobNotFoundException;
import com.venuepulse.sentiment.pipeline.ProcessingRunService;
import com.venuepulse.sentiment.source.BatchSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Accepts processing requests and drives each one through the {@link ProcessingJob} state
 * machine on the job scheduler.
 *
 * <p>The registry is a keyed map; every transition of a job runs inside a per-key
 * {@code compute}, so transitions of one job are serialised without a global lock. A second
 * map holds the active job per batch key; it is claimed with {@code putIfAbsent} at submission
 * and released when the job becomes terminal, so at most one non-terminal job exists per batch.
 *
 * <p>Cancellation is only possible while a job is queued. The cancellation token is re-checked
 * inside the compute that performs QUEUED → RUNNING.
 */
@Service
public class ProcessingJobOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ProcessingJobOrchestrator.class);

    private final Map<String, ProcessingJob> jobs          = new ConcurrentHashMap<>();
    private final Map<String, String>        activeByBatch = new ConcurrentHashMap<>();
    private final Map<String, AtomicBoolean> cancellations = new ConcurrentHashMap<>();

    private final ProcessingRunService runService;
    private final Scheduler scheduler;
    private final Clock clock;

    public ProcessingJobOrchestrator(ProcessingRunService runService,
                                     @Qualifier("jobScheduler") Scheduler scheduler,
                                     Clock clock) {
        this.runService = runService;
        this.scheduler  = scheduler;
        this.clock      = clock;
    }

    /**
     * Registers a job and schedules it.
     *
     * @throws com.venuepulse.common.exception.InvalidParametersException for an unknown mode or priority
     * @throws BatchAlreadyRunningException if the batch already has a queued or running job
     */
    public JobTicket submitProcessingJob(BatchSelector selector, String mode, String priority) {
        ProcessingMode processingMode = ProcessingMode.parse(mode);
        JobPriority jobPriority       = JobPriority.parse(priority);
        String batchKey = selector.batchKey();
        String jobId    = UUID.randomUUID().toString();

        String active = activeByBatch.putIfAbsent(batchKey, jobId);
        if (active != null) {
            log.warn("Job rejected, batch busy. batchKey={} activeJobId={}", batchKey, active);
            throw new BatchAlreadyRunningException(batchKey, active);
        }
        cancellations.put(jobId, new AtomicBoolean(false));
        jobs.put(jobId, ProcessingJob.queued(jobId, batchKey, processingMode, jobPriority, clock.instant()));
        log.info("Job queued. jobId={} batchKey={} mode={} priority={}", jobId, batchKey, processingMode, jobPriority);

        execute(jobId, selector, processingMode)
            .subscribeOn(scheduler)
            .subscribe(
                v -> {},
                e -> log.error("Job execution escaped its handler. jobId={}", jobId, e)
            );

        return new JobTicket(jobId, JobState.QUEUED);
    }

    public Mono<ProcessingJob> getJobStatus(String jobId) {
        return Mono.justOrEmpty(jobs.get(jobId))
            .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)));
    }

    /**
     * Cancels a queued job, moving it to FAILED with reason {@value ProcessingJob#CANCELLED}.
     * A running or finished job is returned unchanged.
     */
    public Mono<ProcessingJob> cancel(String jobId) {
        return Mono.fromCallable(() -> {
            AtomicBoolean token = cancellations.get(jobId);
            ProcessingJob result = update(jobId, job -> {
                if (job.state() != JobState.QUEUED) {
                    return job;
                }
                if (token != null) token.set(true);
                return job.fail(clock.instant(), ProcessingJob.CANCELLED);
            });
            if (result == null) {
                throw new JobNotFoundException(jobId);
            }
            log.info("Cancel requested. jobId={} state={}", jobId, result.state());
            return result;
        });
    }

    // ── Execution ───────────────────────────────────────────────────────────

    private Mono<Void> execute(String jobId, BatchSelector selector, ProcessingMode mode) {
        return Mono.defer(() -> {
            AtomicBoolean token = cancellations.get(jobId);
            ProcessingJob started = update(jobId, job ->
                job.state() == JobState.QUEUED && (token == null || !token.get())
                    ? job.start(clock.instant())
                    : job);
            if (started == null || started.state() != JobState.RUNNING) {
                log.info("Job not started. jobId={} state={}", jobId, started == null ? null : started.state());
                return Mono.empty();
            }
            log.info("Job running. jobId={} batchKey={}", jobId, started.batchKey());

            return runService.run(selector, mode, jobId, pct -> update(jobId, job ->
                    job.state() == JobState.RUNNING ? job.withProgress(pct) : job))
                .doOnNext(summary -> {
                    update(jobId, job -> job.complete(clock.instant(), summary));
                    log.info("Job completed. jobId={} scored={} qualityScore={}",
                        jobId, summary.mentionsScored(), summary.qualityScore());
                })
                .switchIfEmpty(Mono.fromRunnable(() ->
                    update(jobId, job -> job.fail(clock.instant(), "run produced no result"))))
                .onErrorResume(e -> {
                    log.error("Job failed. jobId={}", jobId, e);
                    update(jobId, job -> job.state().terminal() ? job : job.fail(clock.instant(), describe(e)));
                    return Mono.empty();
                })
                .then();
        }).doFinally(signal -> cancellations.remove(jobId));
    }

    /**
     * Applies a transition under the job's key and releases the batch claim once terminal.
     * Returns the job after the transition, or null for an unknown id.
     */
    private ProcessingJob update(String jobId, UnaryOperator<ProcessingJob> transition) {
        ProcessingJob updated = jobs.computeIfPresent(jobId, (id, job) -> transition.apply(job));
        if (updated != null && updated.state().terminal()) {
            activeByBatch.remove(updated.batchKey(), jobId);
        }
        return updated;
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
