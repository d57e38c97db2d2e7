package com.phillippitts.windowanalysis.domain;

/**
 * Frame material recognized in provider responses.
 */
public enum FrameMaterial {
    VINYL("vinyl"),
    WOOD("wood"),
    ALUMINUM("aluminum"),
    COMPOSITE("composite"),
    FIBERGLASS("fiberglass"),
    UNKNOWN("unknown");

    private final String label;

    FrameMaterial(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
