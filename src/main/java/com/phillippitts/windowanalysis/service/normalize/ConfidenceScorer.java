package com.phillippitts.windowanalysis.service.normalize;

import com.phillippitts.windowanalysis.config.properties.NormalizerProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes the 0..100 confidence of a normalized result.
 *
 * <p>Explicit figures ({@code confidence: 85%}, {@code "confidence": 0.9}) are averaged when
 * present. Otherwise the score is the configured base plus one bonus per extracted field,
 * capped at the configured maximum.
 */
public class ConfidenceScorer {

    private static final Pattern EXPLICIT = Pattern.compile("(?i)confidence[\"':\\s]*(\\d+(?:\\.\\d+)?)\\s*(%)?");

    private final NormalizerProperties properties;

    public ConfidenceScorer(NormalizerProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Mean of the explicit confidence figures in the text, or empty if there are none.
     * Fractions such as {@code 0.85} without a percent sign are read as 85.
     */
    public OptionalInt explicitConfidence(String text) {
        if (text == null || text.isEmpty()) {
            return OptionalInt.empty();
        }
        List<Double> figures = new ArrayList<>();
        Matcher m = EXPLICIT.matcher(text);
        while (m.find()) {
            double value = Double.parseDouble(m.group(1));
            boolean percentSign = m.group(2) != null;
            if (!percentSign && m.group(1).contains(".") && value <= 1.0) {
                value *= 100;
            }
            figures.add(Math.max(0, Math.min(100, value)));
        }
        if (figures.isEmpty()) {
            return OptionalInt.empty();
        }
        double sum = 0;
        for (double f : figures) {
            sum += f;
        }
        return OptionalInt.of((int) Math.round(sum / figures.size()));
    }

    /**
     * Base-plus-bonus score for a response without explicit figures.
     */
    public int derivedConfidence(boolean category, boolean material, boolean condition,
                                 boolean dimensions, boolean recommendations) {
        int score = properties.getBaseConfidence();
        if (category) {
            score += properties.getCategoryBonus();
        }
        if (material) {
            score += properties.getMaterialBonus();
        }
        if (condition) {
            score += properties.getConditionBonus();
        }
        if (dimensions) {
            score += properties.getDimensionsBonus();
        }
        if (recommendations) {
            score += properties.getRecommendationBonus();
        }
        return Math.max(0, Math.min(score, Math.min(100, properties.getMaxConfidence())));
    }
}
