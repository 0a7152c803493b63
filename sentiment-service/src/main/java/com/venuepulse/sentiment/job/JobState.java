package com.venuepulse.sentiment.job;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobState {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
