package com.phillippitts.windowanalysis.domain;

/**
 * Overall condition assessment, best first.
 */
public enum WindowCondition {
    EXCELLENT("excellent"),
    GOOD("good"),
    FAIR("fair"),
    POOR("poor"),
    UNKNOWN("unknown");

    private final String label;

    WindowCondition(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
