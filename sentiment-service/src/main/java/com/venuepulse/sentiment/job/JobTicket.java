package com.venuepulse.sentiment.job;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Acknowledgement returned when a job is accepted. */
public record JobTicket(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("status") JobState status
) {}
