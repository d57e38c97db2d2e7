package com.phillippitts.windowanalysis.domain;

/**
 * Caller metadata attached to an analysis request.
 *
 * @param sessionId      client session identifier (nullable)
 * @param locale         caller locale tag, e.g. {@code en-US} (nullable)
 * @param promptOverride custom prompt replacing the provider's default prompt (nullable)
 */
public record RequestContext(String sessionId, String locale, String promptOverride) {

    public static final RequestContext EMPTY = new RequestContext(null, null, null);

    public boolean hasPromptOverride() {
        return promptOverride != null && !promptOverride.isBlank();
    }
}
