package com.venuepulse.sentiment.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.venuepulse.sentiment.pipeline.RunSummary;

import java.time.Instant;

/**
 * Immutable view of a processing job. Each transition returns a new instance and rejects
 * moves the state machine does not allow:
 * <pre>
 *   QUEUED → RUNNING → COMPLETED
 *            RUNNING → FAILED
 *   QUEUED → FAILED (cancelled)
 * </pre>
 * Progress only grows while RUNNING and is 100 once COMPLETED.
 */
public record ProcessingJob(
    @JsonProperty("job_id")         String jobId,
    @JsonProperty("batch_key")      String batchKey,
    @JsonProperty("mode")           ProcessingMode mode,
    @JsonProperty("priority")       JobPriority priority,
    @JsonProperty("status")         JobState state,
    @JsonProperty("created_at")     Instant createdAt,
    @JsonProperty("started_at")     Instant startedAt,
    @JsonProperty("completed_at")   Instant completedAt,
    @JsonProperty("progress")       int progress,
    @JsonProperty("result_summary") RunSummary resultSummary,
    @JsonProperty("failure_reason") String failureReason
) {
    public static final String CANCELLED = "cancelled";

    public static ProcessingJob queued(String jobId, String batchKey, ProcessingMode mode,
                                       JobPriority priority, Instant createdAt) {
        return new ProcessingJob(jobId, batchKey, mode, priority, JobState.QUEUED, createdAt,
            null, null, 0, null, null);
    }

    public ProcessingJob start(Instant at) {
        require(state == JobState.QUEUED, "start");
        return new ProcessingJob(jobId, batchKey, mode, priority, JobState.RUNNING, createdAt,
            at, null, 0, null, null);
    }

    /** Ignores values below the current progress; caps at 99 until completion. */
    public ProcessingJob withProgress(int percent) {
        require(state == JobState.RUNNING, "report progress");
        int next = Math.max(progress, Math.min(99, percent));
        if (next == progress) {
            return this;
        }
        return new ProcessingJob(jobId, batchKey, mode, priority, state, createdAt,
            startedAt, null, next, null, null);
    }

    public ProcessingJob complete(Instant at, RunSummary summary) {
        require(state == JobState.RUNNING, "complete");
        return new ProcessingJob(jobId, batchKey, mode, priority, JobState.COMPLETED, createdAt,
            startedAt, at, 100, summary, null);
    }

    public ProcessingJob fail(Instant at, String reason) {
        require(!state.terminal(), "fail");
        return new ProcessingJob(jobId, batchKey, mode, priority, JobState.FAILED, createdAt,
            startedAt, at, progress, null, reason);
    }

    private void require(boolean allowed, String action) {
        if (!allowed) {
            throw new IllegalStateException("Cannot " + action + " job " + jobId + " in state " + state);
        }
    }
}
