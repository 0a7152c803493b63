package com.venuepulse.common.analytics;

import com.venuepulse.common.model.Mention;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Shared filtering for the analytics engines: keeps mentions created within the last
 * {@code windowDays} days (inclusive of the start instant and of now) and, optionally, only
 * those of the given entities. The result is sorted by entity, creation time, then source id,
 * so sums are taken in the same order whatever order the store returned rows in.
 */
final class MentionWindow {

    static final Comparator<Mention> STABLE_ORDER = Comparator
        .comparing(Mention::entityName)
        .thenComparing(Mention::createdAt)
        .thenComparing(Mention::sourceId);

    private MentionWindow() {}

    static Instant windowStart(Instant now, int windowDays) {
        return now.minus(Duration.ofDays(windowDays));
    }

    static List<Mention> select(Collection<Mention> mentions, Set<String> entities, Instant from, Instant to) {
        return mentions.stream()
            .filter(m -> entities == null || entities.isEmpty() || entities.contains(m.entityName()))
            .filter(m -> !m.createdAt().isBefore(from) && !m.createdAt().isAfter(to))
            .sorted(STABLE_ORDER)
            .toList();
    }
}
