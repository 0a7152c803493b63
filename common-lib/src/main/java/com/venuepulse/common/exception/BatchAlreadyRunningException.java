package com.venuepulse.common.exception;

/**
 * A job for the same logical batch is still queued or running.
 */
public class BatchAlreadyRunningException extends SentimentEngineException {
    private final String batchKey;
    private final String activeJobId;

    public BatchAlreadyRunningException(String batchKey, String activeJobId) {
        super("Batch " + batchKey + " already has an active job: " + activeJobId);
        this.batchKey    = batchKey;
        this.activeJobId = activeJobId;
    }

    public String getBatchKey() {
        return batchKey;
    }

    public String getActiveJobId() {
        return activeJobId;
    }
}
