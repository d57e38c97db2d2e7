package com.phillippitts.windowanalysis.service.normalize;

import com.phillippitts.windowanalysis.config.properties.NormalizerProperties;
import com.phillippitts.windowanalysis.domain.Dimensions;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a plausible width/height pair in inches.
 *
 * <p>Patterns are tried in order and only the first match of each is considered. A match whose
 * values fall outside the plausibility range is discarded (never clamped) and the next pattern
 * is tried.
 */
public class DimensionExtractor {

    private static final String NUMBER = "(\\d+(?:\\.\\d+)?)";
    private static final String INCH_MARK = "(?:\\s*(?:\"|''|”|in(?:ches|ch)?\\b))?";

    static final List<Pattern> PATTERNS = List.of(
            // 30 x 48, 30" x 48", 30in × 48in
            Pattern.compile(NUMBER + INCH_MARK + "\\s*[x×X]\\s*" + NUMBER),
            // width: 30 ... height: 48
            Pattern.compile("(?i)width[:\\s]*" + NUMBER + "[\\s\\S]{0,80}?height[:\\s]*" + NUMBER),
            // 30 by 48
            Pattern.compile("(?i)" + NUMBER + INCH_MARK + "\\s+by\\s+" + NUMBER)
    );

    private final NormalizerProperties properties;

    public DimensionExtractor(NormalizerProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    public Optional<Dimensions> extract(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        for (Pattern pattern : PATTERNS) {
            Matcher m = pattern.matcher(text);
            if (!m.find()) {
                continue;
            }
            double width = parse(m.group(1));
            double height = parse(m.group(2));
            if (isPlausible(width, height)) {
                return Optional.of(new Dimensions(width, height));
            }
        }
        return Optional.empty();
    }

    boolean isPlausible(double width, double height) {
        return width >= properties.getMinWidthInches() && width <= properties.getMaxWidthInches()
                && height >= properties.getMinHeightInches() && height <= properties.getMaxHeightInches();
    }

    private static double parse(String number) {
        try {
            return Double.parseDouble(number);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
