package com.venuepulse.common.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Known venues and their aliases.
 *
 * <p>Resolution order for a piece of text:
 * <ol>
 *   <li>the normalized canonical name or any alias appears as a phrase</li>
 *   <li>the distinctive token of a multi-word name appears (first token when longer than
 *       three characters, otherwise the last token)</li>
 * </ol>
 * When several entities match at the same level, the alphabetically first canonical name wins.
 */
public final class EntityCatalog {

    private final Map<String, List<String>> aliasesByEntity;

    public EntityCatalog(Map<String, List<String>> aliasesByEntity) {
        TreeMap<String, List<String>> copy = new TreeMap<>();
        aliasesByEntity.forEach((name, aliases) ->
            copy.put(name, aliases == null ? List.of() : List.copyOf(aliases)));
        this.aliasesByEntity = Collections.unmodifiableMap(copy);
    }

    public static EntityCatalog empty() {
        return new EntityCatalog(Map.of());
    }

    public Set<String> entityNames() {
        return aliasesByEntity.keySet();
    }

    /** Canonical names plus every alias, normalized. */
    public Set<String> allNormalizedNames() {
        Set<String> names = new TreeSet<>();
        aliasesByEntity.forEach((name, aliases) -> {
            names.add(TextNormalizer.normalize(name));
            aliases.forEach(a -> names.add(TextNormalizer.normalize(a)));
        });
        names.remove("");
        return names;
    }

    public Optional<String> resolve(String text) {
        String normalized = TextNormalizer.normalize(text);
        for (Map.Entry<String, List<String>> e : aliasesByEntity.entrySet()) {
            for (String candidate : candidates(e)) {
                if (TextNormalizer.containsPhrase(normalized, TextNormalizer.normalize(candidate))) {
                    return Optional.of(e.getKey());
                }
            }
        }
        for (String name : aliasesByEntity.keySet()) {
            String token = distinctiveToken(TextNormalizer.normalize(name));
            if (token != null && TextNormalizer.containsPhrase(normalized, token)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    /** Maps a user-supplied name or alias back to its canonical name; unknown names pass through. */
    public String canonicalName(String nameOrAlias) {
        String normalized = TextNormalizer.normalize(nameOrAlias);
        for (Map.Entry<String, List<String>> e : aliasesByEntity.entrySet()) {
            for (String candidate : candidates(e)) {
                if (TextNormalizer.normalize(candidate).equals(normalized)) {
                    return e.getKey();
                }
            }
        }
        return nameOrAlias.trim();
    }

    private static List<String> candidates(Map.Entry<String, List<String>> entry) {
        List<String> all = new ArrayList<>(entry.getValue().size() + 1);
        all.add(entry.getKey());
        all.addAll(entry.getValue());
        return all;
    }

    private static String distinctiveToken(String normalizedName) {
        String[] parts = normalizedName.split(" ");
        if (parts.length < 2) {
            return null;
        }
        return parts[0].length() > 3 ? parts[0] : parts[parts.length - 1];
    }
}
