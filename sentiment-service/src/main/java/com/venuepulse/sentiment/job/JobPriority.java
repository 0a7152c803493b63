package com.venuepulse.sentiment.job;

import com.fasterxml.jackson.annotation.JsonValue;
import com.venuepulse.common.exception.InvalidParametersException;

import java.util.Locale;

/** Recorded on the job for callers; execution order is submission order. */
public enum JobPriority {
    LOW,
    NORMAL,
    HIGH;

    public static JobPriority parse(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidParametersException("priority must be low, normal or high: " + value);
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
