package com.venuepulse.common.text;

import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Finds food and drink terms in a mention. Tags are the matched terms themselves, sorted.
 */
public final class TopicTagExtractor {

    public static final Set<String> FOOD_TERMS = Set.of(
        "wings", "nachos", "burger", "pizza", "fries", "poutine",
        "fish and chips", "tacos", "appetizers", "menu", "food",
        "dinner", "lunch", "brunch", "snacks", "platter"
    );

    public static final Set<String> DRINK_TERMS = Set.of(
        "beer", "craft beer", "wine", "cocktail", "drinks", "draft",
        "ale", "lager", "stout", "ipa", "cider", "happy hour"
    );

    private TopicTagExtractor() {}

    public static SortedSet<String> extract(String text) {
        String normalized = TextNormalizer.normalize(text);
        SortedSet<String> tags = new TreeSet<>();
        for (String term : FOOD_TERMS) {
            if (TextNormalizer.containsPhrase(normalized, term)) tags.add(term);
        }
        for (String term : DRINK_TERMS) {
            if (TextNormalizer.containsPhrase(normalized, term)) tags.add(term);
        }
        return tags;
    }
}
