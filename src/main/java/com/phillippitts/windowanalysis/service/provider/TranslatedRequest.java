package com.phillippitts.windowanalysis.service.provider;

import java.util.Map;
import java.util.Objects;

/**
 * Provider-specific wire request produced by {@link ProviderAdapter#translateRequest}.
 *
 * @param method      HTTP method
 * @param url         absolute URL (may carry an API key in the query string)
 * @param headers     request headers (may carry credentials)
 * @param body        JSON request body
 */
public record TranslatedRequest(String method, String url, Map<String, String> headers, String body) {

    public TranslatedRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static TranslatedRequest post(String url, Map<String, String> headers, String body) {
        return new TranslatedRequest("POST", url, headers, body);
    }

    /**
     * Omits headers, body and query string so credentials never reach the logs.
     */
    @Override
    public String toString() {
        int q = url.indexOf('?');
        String safeUrl = q < 0 ? url : url.substring(0, q);
        return "TranslatedRequest[" + method + " " + safeUrl + ", headers=" + headers.keySet()
                + ", bodyLength=" + (body == null ? 0 : body.length()) + "]";
    }
}
