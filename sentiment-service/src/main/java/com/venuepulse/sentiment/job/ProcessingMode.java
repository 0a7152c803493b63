package com.venuepulse.sentiment.job;

import com.fasterxml.jackson.annotation.JsonValue;
import com.venuepulse.common.exception.InvalidParametersException;
import com.venuepulse.sentiment.adapter.ModelAdapter;

import java.util.Locale;

/**
 * BASIC runs only in-process models; ADVANCED adds the remote ones.
 */
public enum ProcessingMode {
    BASIC,
    ADVANCED;

    public boolean includes(ModelAdapter adapter) {
        return this == ADVANCED || adapter.local();
    }

    public static ProcessingMode parse(String value) {
        if (value == null || value.isBlank()) {
            return ADVANCED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidParametersException("mode must be basic or advanced: " + value);
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
