package com.venuepulse.common.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.venuepulse.common.exception.InvalidParametersException;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Trend bucket size. Boundaries are computed in UTC:
 * DAILY = calendar day, WEEKLY = ISO week (Monday), MONTHLY = first day of the month.
 */
public enum Granularity {
    DAILY,
    WEEKLY,
    MONTHLY;

    public Instant bucketStart(Instant instant) {
        LocalDate day = instant.atZone(ZoneOffset.UTC).toLocalDate();
        LocalDate start = switch (this) {
            case DAILY   -> day;
            case WEEKLY  -> day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTHLY -> day.withDayOfMonth(1);
        };
        return start.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public static Granularity parse(String value) {
        if (value == null || value.isBlank()) {
            return DAILY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidParametersException("granularity must be one of daily, weekly, monthly: " + value);
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
