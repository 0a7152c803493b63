package com.venuepulse.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A validated, scored reference to an entity. Unique by {@code sourceId}; re-scoring replaces
 * the whole record.
 */
public record Mention(
    @JsonProperty("id")          Long id,
    @JsonProperty("entity_name") String entityName,
    @JsonProperty("source_id")   String sourceId,
    @JsonProperty("text")        String text,
    @JsonProperty("created_at")  Instant createdAt,
    @JsonProperty("sentiment")   SentimentResult sentiment,
    @JsonProperty("emotions")    EmotionProfile emotions,
    @JsonProperty("topic_tags")  Set<String> topicTags,
    @JsonProperty("is_derived")  boolean derived,
    @JsonProperty("source_url")  String sourceUrl
) {
    public Mention {
        topicTags = topicTags == null
            ? Collections.emptySortedSet()
            : Collections.unmodifiableSortedSet(new TreeSet<>(topicTags));
    }

    public Mention withId(Long newId) {
        return new Mention(newId, entityName, sourceId, text, createdAt, sentiment, emotions,
            topicTags, derived, sourceUrl);
    }

    public SentimentLabel label() {
        return sentiment.label();
    }
}
