package com.phillippitts.windowanalysis.service.provider;

/**
 * Default analysis prompts for the language-model providers.
 */
final class DefaultPrompts {

    static final String WINDOW_ANALYSIS = """
            Analyze this window photo for a replacement estimate. Report:
            Window type: one of double-hung, casement, sliding, picture, bay, bow, awning, hopper, garden.
            Frame material: one of vinyl, wood, aluminum, composite, fiberglass.
            Condition: excellent, good, fair or poor, with visible issues.
            Dimensions: estimated width x height in inches, if the photo allows it.
            Confidence: an overall confidence percentage (0-100).
            Recommendations: short, practical next steps (measurement, energy efficiency, installation).
            Acknowledge measurement limitations from photos.""";

    private DefaultPrompts() {
    }
}
