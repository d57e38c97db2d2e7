package com.phillippitts.windowanalysis.service.normalize;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One row of an extraction table: text matching {@code pattern} yields {@code value}.
 *
 * @param pattern pattern searched anywhere in the response
 * @param value   canonical value produced on a match
 * @param <T>     canonical value type
 */
public record ExtractionRule<T>(Pattern pattern, T value) {

    public ExtractionRule {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(value, "value");
    }

    /**
     * Case-insensitive whole-word rule.
     */
    public static <T> ExtractionRule<T> word(String regex, T value) {
        return new ExtractionRule<>(Pattern.compile("\\b(?:" + regex + ")\\b", Pattern.CASE_INSENSITIVE), value);
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }
}
