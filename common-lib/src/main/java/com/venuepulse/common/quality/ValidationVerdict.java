package com.venuepulse.common.quality;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Outcome of validating one raw mention. A mention is accepted exactly when no reason applies.
 * {@code entityName} is the canonical entity the mention was attributed to, or {@code null}
 * when none could be resolved.
 */
public record ValidationVerdict(Set<RejectionReason> reasons, double relevanceScore, String entityName) {

    public ValidationVerdict(Set<RejectionReason> reasons, double relevanceScore) {
        this(reasons, relevanceScore, null);
    }

    public ValidationVerdict {
        reasons = reasons.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(RejectionReason.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(reasons));
        if (!Double.isFinite(relevanceScore) || relevanceScore < 0.0 || relevanceScore > 1.0) {
            throw new IllegalArgumentException("relevanceScore out of range: " + relevanceScore);
        }
    }

    public boolean accepted() {
        return reasons.isEmpty();
    }

    public Set<RejectionCategory> categories() {
        Set<RejectionCategory> categories = EnumSet.noneOf(RejectionCategory.class);
        reasons.forEach(r -> categories.add(r.category()));
        return categories;
    }

    public boolean hasCategory(RejectionCategory category) {
        return reasons.stream().anyMatch(r -> r.category() == category);
    }
}
