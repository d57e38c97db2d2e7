package com.phillippitts.windowanalysis.service.normalize;

import com.phillippitts.windowanalysis.domain.Recommendation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls recommendation fragments out of a "Recommendations" section.
 *
 * <p>The section runs from the first {@code recommendation(s)} heading up to a blank line, a line
 * starting with a capital letter or a {@code key: } line, whichever comes first. It is split on
 * periods and line breaks; fragments no longer than the minimum length are dropped.
 */
public class RecommendationExtractor {

    private static final Pattern SECTION = Pattern.compile(
            "(?i:recommendations?)[:\\s]*(.*?)(?=\\n[ \\t]*\\n|\\n[A-Z]|\\n[a-z][\\w.]*: |\\z)", Pattern.DOTALL);

    private static final Pattern FRAGMENT_SPLIT = Pattern.compile("[.\\n]");

    /** Leading list markers such as "-", "*", "•" or "2)". */
    private static final Pattern LIST_MARKER = Pattern.compile("^(?:[-*•]+|\\d+[)])\\s*");

    private static final Map<Recommendation.Category, List<String>> CATEGORY_KEYWORDS = new LinkedHashMap<>();

    static {
        CATEGORY_KEYWORDS.put(Recommendation.Category.MEASUREMENT, List.of("measurement", "measure"));
        CATEGORY_KEYWORDS.put(Recommendation.Category.ENERGY, List.of("energy", "efficiency"));
        CATEGORY_KEYWORDS.put(Recommendation.Category.MATERIAL, List.of("material", "frame"));
        CATEGORY_KEYWORDS.put(Recommendation.Category.INSTALLATION, List.of("installation", "install"));
        CATEGORY_KEYWORDS.put(Recommendation.Category.MAINTENANCE, List.of("maintenance", "repair"));
    }

    private final int minLength;

    public RecommendationExtractor(int minLength) {
        this.minLength = minLength;
    }

    public List<Recommendation> extract(String text) {
        List<Recommendation> result = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return result;
        }
        Matcher section = SECTION.matcher(text);
        if (!section.find()) {
            return result;
        }
        for (String raw : FRAGMENT_SPLIT.split(section.group(1))) {
            String fragment = LIST_MARKER.matcher(raw.trim()).replaceFirst("").trim();
            if (fragment.length() > minLength) {
                result.add(new Recommendation(fragment, categorize(fragment), prioritize(fragment)));
            }
        }
        return result;
    }

    static Recommendation.Category categorize(String fragment) {
        String lower = fragment.toLowerCase(Locale.ROOT);
        for (Map.Entry<Recommendation.Category, List<String>> entry : CATEGORY_KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (lower.contains(keyword)) {
                    return entry.getKey();
                }
            }
        }
        return Recommendation.Category.GENERAL;
    }

    static Recommendation.Priority prioritize(String fragment) {
        String lower = fragment.toLowerCase(Locale.ROOT);
        if (lower.contains("urgent") || lower.contains("immediate")) {
            return Recommendation.Priority.HIGH;
        }
        if (lower.contains("soon") || lower.contains("important")) {
            return Recommendation.Priority.MEDIUM;
        }
        return Recommendation.Priority.LOW;
    }
}
