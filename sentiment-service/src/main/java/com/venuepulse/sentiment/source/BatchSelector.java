package com.venuepulse.sentiment.source;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.venuepulse.common.exception.InvalidParametersException;
import com.venuepulse.common.text.TextNormalizer;

import java.time.Instant;

/**
 * Which raw items a processing run pulls from the content source. {@code since}/{@code until}
 * may be null for an open range.
 */
public record BatchSelector(
    @JsonProperty("source") String source,
    @JsonProperty("since")  Instant since,
    @JsonProperty("until")  Instant until,
    @JsonProperty("limit")  int limit
) {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT     = 1_000;

    public BatchSelector {
        if (source == null || source.isBlank()) {
            throw new InvalidParametersException("batch source must not be blank");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidParametersException("batch limit must be in [1, " + MAX_LIMIT + "]: " + limit);
        }
        if (since != null && until != null && until.isBefore(since)) {
            throw new InvalidParametersException("batch until is before since");
        }
    }

    public static BatchSelector of(String source) {
        return new BatchSelector(source, null, null, DEFAULT_LIMIT);
    }

    /** Jobs with the same key compete for the same batch: the normalized source name. */
    public String batchKey() {
        return TextNormalizer.normalize(source).replace(' ', '-');
    }
}
