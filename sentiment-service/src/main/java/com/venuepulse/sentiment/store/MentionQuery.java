package com.venuepulse.sentiment.store;

import com.venuepulse.common.model.Mention;

import java.time.Instant;
import java.util.Set;

/**
 * Read filter for {@link MentionStore#query(MentionQuery)}. Empty {@code entities} means all
 * entities; null bounds are open. Results come newest first, cut to {@code limit} when set.
 */
public record MentionQuery(Set<String> entities, Instant from, Instant to, Integer limit) {

    public MentionQuery {
        entities = entities == null ? Set.of() : Set.copyOf(entities);
    }

    public static MentionQuery all() {
        return new MentionQuery(Set.of(), null, null, null);
    }

    public static MentionQuery window(Set<String> entities, Instant from, Instant to) {
        return new MentionQuery(entities, from, to, null);
    }

    public static MentionQuery latest(String entity, int limit) {
        return new MentionQuery(Set.of(entity), null, null, limit);
    }

    public boolean matches(Mention mention) {
        return (entities.isEmpty() || entities.contains(mention.entityName()))
            && (from == null || !mention.createdAt().isBefore(from))
            && (to == null || !mention.createdAt().isAfter(to));
    }
}
