package com.venuepulse.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Emotion name → intensity in [0, 1]. Keys are kept sorted so two profiles built from the
 * same values serialize identically.
 */
public record EmotionProfile(Map<String, Double> intensities) {

    public EmotionProfile {
        TreeMap<String, Double> sorted = new TreeMap<>();
        intensities.forEach((name, value) -> {
            if (value == null || !Double.isFinite(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException("emotion intensity out of range: " + name + "=" + value);
            }
            sorted.put(name.toLowerCase(Locale.ROOT), value);
        });
        intensities = Collections.unmodifiableMap(sorted);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EmotionProfile of(Map<String, Double> intensities) {
        return new EmotionProfile(intensities);
    }

    @JsonValue
    public Map<String, Double> intensities() {
        return intensities;
    }

    /** Highest-intensity emotions first, ties by name. */
    public Map<String, Double> top(int n) {
        return intensities.entrySet().stream()
            .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(n)
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue,
                (a, b) -> a, LinkedHashMap::new));
    }
}
