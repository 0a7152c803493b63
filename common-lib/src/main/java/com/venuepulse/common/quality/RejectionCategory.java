package com.venuepulse.common.quality;

/** Coarse grouping of rejection reasons, as reported in quality snapshots. */
public enum RejectionCategory {
    LENGTH,
    SPAM,
    DUPLICATE,
    RELEVANCE
}
