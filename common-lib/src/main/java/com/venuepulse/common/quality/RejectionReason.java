package com.venuepulse.common.quality;

/**
 * Why the validator refused a mention. Several reasons can apply to one mention.
 */
public enum RejectionReason {
    TOO_SHORT(RejectionCategory.LENGTH),
    TOO_LONG(RejectionCategory.LENGTH),
    DELETED_CONTENT(RejectionCategory.LENGTH),
    SPAM_KEYWORDS(RejectionCategory.SPAM),
    EXCESSIVE_CAPITALS(RejectionCategory.SPAM),
    REPEATED_CHARACTERS(RejectionCategory.SPAM),
    FLAGGED_AUTHOR(RejectionCategory.SPAM),
    DUPLICATE_TEXT(RejectionCategory.DUPLICATE),
    LOW_RELEVANCE(RejectionCategory.RELEVANCE),
    UNRESOLVED_ENTITY(RejectionCategory.RELEVANCE);

    private final RejectionCategory category;

    RejectionReason(RejectionCategory category) {
        this.category = category;
    }

    public RejectionCategory category() {
        return category;
    }
}
