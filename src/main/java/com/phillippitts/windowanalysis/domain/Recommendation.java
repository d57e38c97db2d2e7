package com.phillippitts.windowanalysis.domain;

import java.util.Objects;

/**
 * One recommendation fragment lifted from a provider response.
 *
 * @param text     recommendation sentence, trimmed
 * @param category coarse topic assigned by keyword matching
 * @param priority urgency assigned by keyword matching
 */
public record Recommendation(String text, Category category, Priority priority) {

    public enum Category { MEASUREMENT, ENERGY, MATERIAL, INSTALLATION, MAINTENANCE, GENERAL }

    public enum Priority { HIGH, MEDIUM, LOW }

    public Recommendation {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(priority, "priority");
    }
}
