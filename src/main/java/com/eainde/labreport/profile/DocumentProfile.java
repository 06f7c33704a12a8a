package com.eainde.labreport.profile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A recurring, fixed report layout. When enough {@code indicators} occur on a page
 * the page is read through {@link TemplateExtractor} using the profile's closed
 * list of {@link ExpectedMetric}s instead of generic patterns.
 *
 * @param id              stable identifier, reported on the page result
 * @param indicators      words whose presence identifies the layout
 * @param minMatches      indicators required for a match
 * @param noiseKeywords   administrative lines dropped from the cleaned text
 * @param keepKeywords    lines kept in the cleaned text
 * @param expectedMetrics metrics to look for, in output order
 * @param unitCorrections misread unit to corrected unit, checked in order
 * @param defaultUnit     unit used when none is found next to a value
 */
public record DocumentProfile(
        String id,
        List<String> indicators,
        int minMatches,
        List<String> noiseKeywords,
        List<String> keepKeywords,
        List<ExpectedMetric> expectedMetrics,
        Map<String, String> unitCorrections,
        String defaultUnit
) {

    private static final Pattern DECIMAL = Pattern.compile("\\d+[.,]\\d+");

    public DocumentProfile {
        if (minMatches < 1) {
            throw new IllegalArgumentException("minMatches must be >= 1 for profile " + id);
        }
        indicators = List.copyOf(indicators);
        noiseKeywords = List.copyOf(noiseKeywords);
        keepKeywords = List.copyOf(keepKeywords);
        expectedMetrics = List.copyOf(expectedMetrics);
        unitCorrections = Collections.unmodifiableMap(new LinkedHashMap<>(unitCorrections));
    }

    /**
     * @return number of distinct indicators found in the joined fragments
     */
    public int indicatorMatches(List<String> fragments) {
        String text = String.join(" ", fragments).toLowerCase(Locale.ROOT);
        int matches = 0;
        for (String indicator : indicators) {
            if (text.contains(indicator.toLowerCase(Locale.ROOT))) {
                matches++;
            }
        }
        return matches;
    }

    public boolean matches(List<String> fragments) {
        return indicatorMatches(fragments) >= minMatches;
    }

    /**
     * Fragments with administrative noise removed, keeping lines that mention a
     * metric word, a unit, or a decimal number.
     */
    public List<String> cleanLines(List<String> fragments) {
        return fragments.stream()
                .filter(f -> !containsAny(f, noiseKeywords))
                .filter(f -> containsAny(f, keepKeywords) || DECIMAL.matcher(f).find())
                .toList();
    }

    public Optional<String> correctUnit(String fragment) {
        String lower = fragment.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> correction : unitCorrections.entrySet()) {
            if (lower.contains(correction.getKey())) {
                return Optional.of(correction.getValue());
            }
        }
        return Optional.empty();
    }

    private static boolean containsAny(String fragment, List<String> keywords) {
        String lower = fragment.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
