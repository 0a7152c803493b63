package com.venuepulse.sentiment.adapter;

import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Reads a word list: one entry per line, {@code #} starts a comment, blank lines ignored,
 * entries lower-cased.
 */
final class WordListLoader {

    private WordListLoader() {}

    static Set<String> load(Resource resource) {
        if (resource == null) {
            return Collections.emptySet();
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            TreeSet<String> words = reader.lines()
                .map(line -> {
                    int commentIdx = line.indexOf('#');
                    return commentIdx >= 0 ? line.substring(0, commentIdx) : line;
                })
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .map(line -> line.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(TreeSet::new));
            return Collections.unmodifiableSet(words);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load word list from " + resource, e);
        }
    }
}
