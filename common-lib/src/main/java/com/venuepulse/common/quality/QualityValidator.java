package com.venuepulse.common.quality;

import com.venuepulse.common.model.RawMention;
import com.venuepulse.common.text.EntityCatalog;
import com.venuepulse.common.text.TextNormalizer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a raw mention is trustworthy enough to be scored.
 *
 * <p>Every rule is evaluated, so a verdict lists all reasons that apply rather than the first.
 * The only state is the duplicate window: normalized texts of the most recently accepted
 * mentions, oldest evicted first. One instance serves one processing run and is not
 * thread-safe; callers validate a run's mentions sequentially so the window is deterministic.
 *
 * <h3>Relevance</h3>
 * <pre>
 *   relevance = min(1, (domainKeywordHits + 2 × aliasHits) / wordCount)
 * </pre>
 * Hits count distinct keywords and distinct names found as whole-word phrases in the normalized
 * text. The entity hint of the mention counts as a name.
 *
 * <h3>Entity</h3>
 * A non-blank entity hint is mapped to its canonical catalogue name (unknown hints are kept
 * as given). Without a hint the entity is resolved from the text; failing that the mention is
 * rejected as {@link RejectionReason#UNRESOLVED_ENTITY}.
 */
public class QualityValidator {

    private final ValidatorSettings settings;
    private final EntityCatalog catalog;
    private final Set<String> knownNames;
    private final Deque<String> recent = new ArrayDeque<>();
    private final Set<String> recentIndex = new HashSet<>();

    public QualityValidator(ValidatorSettings settings, EntityCatalog catalog) {
        this.settings   = settings;
        this.catalog    = catalog;
        this.knownNames = catalog.allNormalizedNames();
    }

    public ValidationVerdict validate(RawMention mention) {
        String text = mention.text() == null ? "" : mention.text();
        Set<RejectionReason> reasons = EnumSet.noneOf(RejectionReason.class);

        int length = text.length();
        if (length < settings.minLength()) reasons.add(RejectionReason.TOO_SHORT);
        if (length > settings.maxLength()) reasons.add(RejectionReason.TOO_LONG);
        if (settings.deletedPlaceholders().contains(text.trim().toLowerCase(Locale.ROOT))) {
            reasons.add(RejectionReason.DELETED_CONTENT);
        }

        if (spamKeywordCount(text) >= settings.spamKeywordThreshold()) {
            reasons.add(RejectionReason.SPAM_KEYWORDS);
        }
        if (length > settings.uppercaseMinLength() && uppercaseRatio(text) > settings.uppercaseRatioLimit()) {
            reasons.add(RejectionReason.EXCESSIVE_CAPITALS);
        }
        if (longestRun(text) >= settings.repeatedCharacterRun()) {
            reasons.add(RejectionReason.REPEATED_CHARACTERS);
        }
        if (mention.authorFlaggedSpammer()) {
            reasons.add(RejectionReason.FLAGGED_AUTHOR);
        }

        String normalized = TextNormalizer.normalize(text);
        if (recentIndex.contains(normalized)) {
            reasons.add(RejectionReason.DUPLICATE_TEXT);
        }

        double relevance = relevance(normalized, mention.entityHint());
        if (relevance < settings.relevanceFloor()) {
            reasons.add(RejectionReason.LOW_RELEVANCE);
        }

        Optional<String> entity = resolveEntity(mention);
        if (entity.isEmpty()) {
            reasons.add(RejectionReason.UNRESOLVED_ENTITY);
        }

        ValidationVerdict verdict = new ValidationVerdict(reasons, relevance, entity.orElse(null));
        if (verdict.accepted()) {
            remember(normalized);
        }
        return verdict;
    }

    private Optional<String> resolveEntity(RawMention mention) {
        String hint = mention.entityHint();
        if (hint != null && !hint.isBlank()) {
            return Optional.of(catalog.canonicalName(hint));
        }
        return mention.text() == null ? Optional.empty() : catalog.resolve(mention.text());
    }

    double relevance(String normalized, String entityHint) {
        List<String> words = TextNormalizer.words(normalized);
        if (words.isEmpty()) {
            return 0.0;
        }
        long keywordHits = settings.domainKeywords().stream()
            .filter(k -> TextNormalizer.containsPhrase(normalized, k))
            .count();

        Set<String> names = new HashSet<>(knownNames);
        if (entityHint != null) {
            String hint = TextNormalizer.normalize(entityHint);
            if (!hint.isEmpty()) names.add(hint);
        }
        long aliasHits = names.stream()
            .filter(n -> TextNormalizer.containsPhrase(normalized, n))
            .count();

        return Math.min(1.0, (keywordHits + 2.0 * aliasHits) / words.size());
    }

    private int spamKeywordCount(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        int count = 0;
        for (String keyword : settings.spamKeywords()) {
            if (lower.contains(keyword)) count++;
        }
        return count;
    }

    private static double uppercaseRatio(String text) {
        if (text.isEmpty()) return 0.0;
        long upper = text.chars().filter(Character::isUpperCase).count();
        return (double) upper / text.length();
    }

    private static int longestRun(String text) {
        int best = 0;
        int run  = 0;
        int prev = -1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                run = 0;
                prev = -1;
                continue;
            }
            run = c == prev ? run + 1 : 1;
            prev = c;
            best = Math.max(best, run);
        }
        return best;
    }

    private void remember(String normalized) {
        if (settings.duplicateWindow() == 0 || normalized.isEmpty()) {
            return;
        }
        recent.addLast(normalized);
        recentIndex.add(normalized);
        while (recent.size() > settings.duplicateWindow()) {
            String evicted = recent.removeFirst();
            if (!recent.contains(evicted)) {
                recentIndex.remove(evicted);
            }
        }
    }
}
