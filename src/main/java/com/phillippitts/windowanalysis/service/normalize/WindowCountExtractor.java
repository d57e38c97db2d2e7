package com.phillippitts.windowanalysis.service.normalize;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a stated window count such as {@code "Window count: 3"} or a flattened
 * {@code window_count: 3}. Only the first statement is considered.
 */
public final class WindowCountExtractor {

    static final Pattern PATTERN = Pattern.compile("(?i)windows?[\\s_]*count[*:\\s]*(\\d+)");

    private WindowCountExtractor() {
    }

    public static OptionalInt extract(String text) {
        if (text == null || text.isEmpty()) {
            return OptionalInt.empty();
        }
        Matcher m = PATTERN.matcher(text);
        if (!m.find()) {
            return OptionalInt.empty();
        }
        String digits = m.group(1);
        // anything past nine digits is not a count of windows in one photo
        if (digits.length() > 9) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(digits));
    }
}
