package com.phillippitts.windowanalysis.service.provider.transport;

import com.phillippitts.windowanalysis.exception.TransportException;
import com.phillippitts.windowanalysis.service.provider.TranslatedRequest;

/**
 * Sends translated requests to external providers.
 *
 * <p>Implementations must support independent concurrent in-flight calls.
 */
public interface ProviderTransport {

    /**
     * Sends a request and returns the raw response body of a 2xx response.
     *
     * @param providerId provider being called (for errors and logs)
     * @param request    wire request
     * @param timeoutMs  bound on the whole call
     * @return raw response body
     * @throws TransportException on non-2xx status, network failure or timeout
     */
    String send(String providerId, TranslatedRequest request, long timeoutMs);
}
