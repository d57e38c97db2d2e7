package com.phillippitts.windowanalysis.service.provider;

/**
 * Provider identifier constants, used as map keys, metric tags and config keys.
 */
public final class ProviderIds {

    public static final String ANTHROPIC = "anthropic";
    public static final String OPENAI = "openai";
    public static final String GOOGLE_VISION = "google-vision";

    private ProviderIds() {
    }
}
