package com.venuepulse.common.quality;

import java.util.Set;

/**
 * Thresholds and word lists for {@link QualityValidator}.
 *
 * <ul>
 *   <li>{@code minLength}/{@code maxLength}: accepted text length range, inclusive</li>
 *   <li>{@code spamKeywordThreshold}: promotional phrases needed to call a text spam</li>
 *   <li>{@code uppercaseRatioLimit}: capitals ratio above which a text is spam, checked
 *       only for texts longer than {@code uppercaseMinLength}</li>
 *   <li>{@code repeatedCharacterRun}: run of identical characters that marks spam</li>
 *   <li>{@code duplicateWindow}: number of recent accepted texts remembered</li>
 *   <li>{@code relevanceFloor}: minimum relevance score</li>
 * </ul>
 */
public record ValidatorSettings(
    int minLength,
    int maxLength,
    Set<String> spamKeywords,
    int spamKeywordThreshold,
    double uppercaseRatioLimit,
    int uppercaseMinLength,
    int repeatedCharacterRun,
    int duplicateWindow,
    double relevanceFloor,
    Set<String> domainKeywords,
    Set<String> deletedPlaceholders
) {
    public static final Set<String> DEFAULT_SPAM_KEYWORDS = Set.of(
        "spam", "bot", "advertisement", "promo code", "discount code",
        "click here", "visit our", "buy now", "limited time"
    );

    public static final Set<String> DEFAULT_DOMAIN_KEYWORDS = Set.of(
        "restaurant", "bar", "pub", "brewery", "cafe", "food", "drink",
        "beer", "wine", "cocktail", "menu", "service", "server", "waiter",
        "dinner", "lunch", "brunch", "eat", "ate", "meal", "taste", "flavor",
        "atmosphere", "ambiance", "patio", "reservation", "kitchen"
    );

    public static final Set<String> DEFAULT_DELETED_PLACEHOLDERS = Set.of("[deleted]", "[removed]");

    public ValidatorSettings {
        if (minLength < 0 || maxLength < minLength) {
            throw new IllegalArgumentException("invalid length range: " + minLength + ".." + maxLength);
        }
        if (spamKeywordThreshold < 1 || repeatedCharacterRun < 2) {
            throw new IllegalArgumentException("spam thresholds must be positive");
        }
        if (uppercaseRatioLimit < 0.0 || uppercaseRatioLimit > 1.0) {
            throw new IllegalArgumentException("uppercaseRatioLimit must be in [0, 1]");
        }
        if (duplicateWindow < 0) {
            throw new IllegalArgumentException("duplicateWindow must not be negative");
        }
        if (relevanceFloor < 0.0 || relevanceFloor > 1.0) {
            throw new IllegalArgumentException("relevanceFloor must be in [0, 1]");
        }
        spamKeywords        = Set.copyOf(spamKeywords);
        domainKeywords      = Set.copyOf(domainKeywords);
        deletedPlaceholders = Set.copyOf(deletedPlaceholders);
    }

    public static ValidatorSettings defaults() {
        return new ValidatorSettings(10, 10_000, DEFAULT_SPAM_KEYWORDS, 2, 0.5, 10, 5, 500, 0.1,
            DEFAULT_DOMAIN_KEYWORDS, DEFAULT_DELETED_PLACEHOLDERS);
    }

    public ValidatorSettings withDuplicateWindow(int window) {
        return new ValidatorSettings(minLength, maxLength, spamKeywords, spamKeywordThreshold,
            uppercaseRatioLimit, uppercaseMinLength, repeatedCharacterRun, window, relevanceFloor,
            domainKeywords, deletedPlaceholders);
    }
}
