package com.phillippitts.windowanalysis.service.provider;

import com.phillippitts.windowanalysis.domain.AnalysisRequest;

/**
 * Translator between the canonical analysis contract and one provider's wire format.
 *
 * <p>The fan-out coordinator drives a call as
 * {@code translateResponse(invoke(translateRequest(request, credential), timeoutMs))}
 * inside the retry executor, which consults {@link #isTransientFailure(Throwable)} to
 * decide whether a failure is worth retrying.
 *
 * <p>Implementations must be thread-safe: one adapter instance serves every concurrent request.
 */
public interface ProviderAdapter {

    /**
     * Stable identifier, e.g. {@code "anthropic"}.
     */
    String providerId();

    /**
     * Name of the credential to look up in the credential store.
     */
    String credentialName();

    /**
     * Builds the provider request for an analysis.
     *
     * @param request    canonical request (image payload, context, prompt override)
     * @param credential secret from the credential store
     * @return wire request ready for the transport
     */
    TranslatedRequest translateRequest(AnalysisRequest request, String credential);

    /**
     * Sends the request and returns the raw response body.
     *
     * @throws com.phillippitts.windowanalysis.exception.TransportException on HTTP or network failure
     */
    String invoke(TranslatedRequest translated, long timeoutMs);

    /**
     * Extracts the analysis text from a raw response body.
     *
     * @throws com.phillippitts.windowanalysis.exception.ProviderException if the body carries a
     *         typed error payload or no usable content
     */
    String translateResponse(String rawResponse);

    /**
     * Whether a failure from {@link #invoke} or {@link #translateResponse} is transient.
     */
    boolean isTransientFailure(Throwable failure);
}
