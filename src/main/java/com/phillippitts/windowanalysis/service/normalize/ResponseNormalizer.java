package com.phillippitts.windowanalysis.service.normalize;

import com.phillippitts.windowanalysis.domain.NormalizedResult;

/**
 * Extracts canonical window fields from one provider's raw response text.
 *
 * <p>Implementations are pure: normalizing the same input twice yields equal results.
 */
public interface ResponseNormalizer {

    /**
     * @param providerId  provider that produced the response
     * @param rawResponse analysis text (free text or a JSON object)
     * @return normalized result; fields that could not be extracted are {@code UNKNOWN}/absent
     */
    NormalizedResult normalize(String providerId, String rawResponse);
}
