package com.venuepulse.common.exception;

public class JobNotFoundException extends SentimentEngineException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Unknown processing job: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
