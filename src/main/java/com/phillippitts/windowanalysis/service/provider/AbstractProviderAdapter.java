package com.phillippitts.windowanalysis.service.provider;

import com.phillippitts.windowanalysis.config.properties.ProviderProperties;
import com.phillippitts.windowanalysis.domain.AnalysisRequest;
import com.phillippitts.windowanalysis.exception.FailureKind;
import com.phillippitts.windowanalysis.exception.ProviderException;
import com.phillippitts.windowanalysis.exception.ProviderExceptionBuilder;
import com.phillippitts.windowanalysis.exception.TransportException;
import com.phillippitts.windowanalysis.service.provider.transport.ProviderTransport;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Template for HTTP/JSON provider adapters.
 *
 * <p>Supplies the transport call and the failure classification shared by every provider:
 * <ul>
 *   <li>Transient: timeouts, network failures, HTTP 408/425/429 and 5xx, and messages containing
 *       one of {@link #TRANSIENT_MARKERS}</li>
 *   <li>Permanent: everything else, notably 400/401/403/404/413/415/422</li>
 * </ul>
 *
 * <p>Subclasses build the request body, extract text from the response and may widen the
 * transient set through {@link #isTransientStatus(int)} and {@link #isTransientErrorBody(String)}.
 *
 * <p><b>Thread Safety:</b> Stateless apart from immutable configuration.
 */
public abstract class AbstractProviderAdapter implements ProviderAdapter {

    /** Lower-cased message fragments that mark a failure as transient. */
    protected static final List<String> TRANSIENT_MARKERS = List.of(
            "timeout", "timed out", "overloaded", "rate limit", "temporarily unavailable");

    protected final ProviderProperties.Settings settings;
    private final ProviderTransport transport;

    protected AbstractProviderAdapter(ProviderProperties.Settings settings, ProviderTransport transport) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @Override
    public String credentialName() {
        return settings.getCredentialName();
    }

    @Override
    public final String invoke(TranslatedRequest translated, long timeoutMs) {
        return transport.send(providerId(), translated, timeoutMs);
    }

    @Override
    public final String translateResponse(String rawResponse) {
        if (rawResponse == null || rawResponse.isBlank()) {
            throw ProviderExceptionBuilder.create("Empty response body")
                    .provider(providerId())
                    .retryable()
                    .build();
        }
        JSONObject json;
        try {
            json = new JSONObject(rawResponse);
        } catch (JSONException e) {
            throw ProviderExceptionBuilder.create("Response is not a JSON object")
                    .provider(providerId())
                    .cause(e)
                    .build();
        }
        String text = extractText(json);
        if (text == null || text.isBlank()) {
            throw ProviderExceptionBuilder.create("Response contained no analysis text")
                    .provider(providerId())
                    .build();
        }
        return text.trim();
    }

    /**
     * Pulls the analysis text out of a parsed 2xx response body.
     *
     * @throws ProviderException if the body carries a typed error payload
     */
    protected abstract String extractText(JSONObject response);

    @Override
    public boolean isTransientFailure(Throwable failure) {
        Throwable cur = failure;
        while (cur != null) {
            if (cur instanceof ProviderException pe) {
                return pe.getKind() == FailureKind.TRANSIENT;
            }
            if (cur instanceof TransportException te) {
                if (te.isTimeout()) {
                    return true;
                }
                if (!te.hasStatus()) {
                    // no response at all: connection refused, reset, DNS
                    return true;
                }
                return isTransientStatus(te.getStatusCode()) || isTransientErrorBody(te.getResponseBody());
            }
            cur = cur.getCause();
        }
        return containsTransientMarker(failure == null ? null : failure.getMessage());
    }

    /**
     * Whether an HTTP status is worth retrying. Default: 408, 425, 429 and 5xx.
     */
    protected boolean isTransientStatus(int status) {
        return status == 408 || status == 425 || status == 429 || (status >= 500 && status <= 599);
    }

    /**
     * Whether a non-2xx error body marks the failure as transient. Default: message markers only.
     */
    protected boolean isTransientErrorBody(String body) {
        return containsTransientMarker(body);
    }

    protected static boolean containsTransientMarker(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String marker : TRANSIENT_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Prompt for a request: the caller's override, else the configured prompt, else the adapter default.
     */
    protected String promptFor(AnalysisRequest request) {
        if (request.context().hasPromptOverride()) {
            return request.context().promptOverride();
        }
        String configured = settings.getPrompt();
        return configured != null && !configured.isBlank() ? configured : defaultPrompt();
    }

    protected abstract String defaultPrompt();

    protected String baseUrl() {
        String url = settings.getBaseUrl();
        if (url == null || url.isBlank()) {
            throw ProviderExceptionBuilder.create("Base URL not configured").provider(providerId()).build();
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
