package com.phillippitts.windowanalysis.service.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered extraction rules for one field. The first matching rule wins; no match yields the fallback.
 *
 * @param <T> canonical value type
 */
public final class RuleTable<T> {

    private final List<ExtractionRule<T>> rules;
    private final T fallback;

    public RuleTable(List<ExtractionRule<T>> rules, T fallback) {
        this.rules = List.copyOf(rules);
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public T firstMatch(String text) {
        if (text == null || text.isEmpty()) {
            return fallback;
        }
        for (ExtractionRule<T> rule : rules) {
            if (rule.matches(text)) {
                return rule.value();
            }
        }
        return fallback;
    }

    /**
     * Every distinct value whose rule matches, in rule order.
     */
    public List<T> allMatches(String text) {
        List<T> matched = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return matched;
        }
        for (ExtractionRule<T> rule : rules) {
            if (!matched.contains(rule.value()) && rule.matches(text)) {
                matched.add(rule.value());
            }
        }
        return matched;
    }
}
