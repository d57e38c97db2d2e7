package com.phillippitts.windowanalysis.domain;

/**
 * Window operating style recognized in provider responses.
 */
public enum WindowCategory {
    DOUBLE_HUNG("double-hung"),
    CASEMENT("casement"),
    SLIDING("sliding"),
    PICTURE("picture"),
    BAY("bay"),
    BOW("bow"),
    AWNING("awning"),
    HOPPER("hopper"),
    GARDEN("garden"),
    UNKNOWN("unknown");

    private final String label;

    WindowCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
