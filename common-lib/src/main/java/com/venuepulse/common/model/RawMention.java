package com.venuepulse.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One item as yielded by the content source, before validation and scoring.
 *
 * <p>{@code entityHint} may be null; the pipeline then resolves the entity from the alias
 * catalogue. {@code authorFlaggedSpammer} and {@code sourceType} are validator metadata.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawMention(
    @JsonProperty("text")                   String text,
    @JsonProperty("entity_hint")            String entityHint,
    @JsonProperty("created_at")             Instant createdAt,
    @JsonProperty("source_id")              String sourceId,
    @JsonProperty("is_derived")             boolean derived,
    @JsonProperty("source_url")             String sourceUrl,
    @JsonProperty("source_type")            String sourceType,
    @JsonProperty("author_flagged_spammer") boolean authorFlaggedSpammer
) {
    public static RawMention of(String sourceId, String entityHint, String text, Instant createdAt) {
        return new RawMention(text, entityHint, createdAt, sourceId, false, null, "post", false);
    }

    public int length() {
        return text == null ? 0 : text.length();
    }
}
