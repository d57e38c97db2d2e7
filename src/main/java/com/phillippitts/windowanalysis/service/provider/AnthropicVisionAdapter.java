package com.phillippitts.windowanalysis.service.provider;

import com.phillippitts.windowanalysis.config.properties.ProviderProperties;
import com.phillippitts.windowanalysis.domain.AnalysisRequest;
import com.phillippitts.windowanalysis.exception.ProviderExceptionBuilder;
import com.phillippitts.windowanalysis.service.provider.transport.ProviderTransport;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Anthropic Messages API adapter.
 *
 * <p>The image travels as a base64 {@code source} block next to the text prompt; the reply is
 * the concatenation of all {@code text} content blocks. Errors arrive as a typed payload
 * {@code {"type":"error","error":{"type":"overloaded_error",...}}}, usually with HTTP 529 or 429.
 */
public class AnthropicVisionAdapter extends AbstractProviderAdapter {

    static final String DEFAULT_API_VERSION = "2023-06-01";

    private static final Set<String> TRANSIENT_ERROR_TYPES = Set.of(
            "overloaded_error", "rate_limit_error", "api_error", "timeout_error");

    public AnthropicVisionAdapter(ProviderProperties.Settings settings, ProviderTransport transport) {
        super(settings, transport);
    }

    @Override
    public String providerId() {
        return ProviderIds.ANTHROPIC;
    }

    @Override
    public TranslatedRequest translateRequest(AnalysisRequest request, String credential) {
        JSONObject source = new JSONObject()
                .put("type", "base64")
                .put("media_type", request.payload().mediaType())
                .put("data", request.payload().base64Data());

        JSONArray content = new JSONArray()
                .put(new JSONObject().put("type", "image").put("source", source))
                .put(new JSONObject().put("type", "text").put("text", promptFor(request)));

        JSONObject body = new JSONObject()
                .put("model", settings.getModel())
                .put("max_tokens", settings.getMaxTokens())
                .put("temperature", settings.getTemperature())
                .put("messages", new JSONArray().put(new JSONObject().put("role", "user").put("content", content)));

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("x-api-key", credential);
        headers.put("anthropic-version", apiVersion());
        headers.put("Content-Type", "application/json");

        return TranslatedRequest.post(baseUrl() + "/v1/messages", headers, body.toString());
    }

    @Override
    protected String extractText(JSONObject response) {
        if ("error".equals(response.optString("type")) || response.has("error")) {
            JSONObject error = response.optJSONObject("error");
            String type = error != null ? error.optString("type", "unknown") : "unknown";
            throw ProviderExceptionBuilder.create("Provider reported an error")
                    .provider(providerId())
                    .retryableIf(TRANSIENT_ERROR_TYPES.contains(type))
                    .metadata("errorType", type)
                    .metadata("errorMessage", error != null ? error.optString("message", null) : null)
                    .build();
        }

        StringBuilder text = new StringBuilder();
        JSONArray blocks = response.optJSONArray("content");
        if (blocks != null) {
            for (int i = 0; i < blocks.length(); i++) {
                JSONObject block = blocks.optJSONObject(i);
                if (block != null && "text".equals(block.optString("type"))) {
                    text.append(block.optString("text", ""));
                }
            }
        }
        return text.toString();
    }

    /**
     * Adds Anthropic's 529 overload status to the default transient set.
     */
    @Override
    protected boolean isTransientStatus(int status) {
        return status == 529 || super.isTransientStatus(status);
    }

    @Override
    protected boolean isTransientErrorBody(String body) {
        if (body != null && !body.isBlank()) {
            try {
                JSONObject error = new JSONObject(body).optJSONObject("error");
                if (error != null && TRANSIENT_ERROR_TYPES.contains(error.optString("type"))) {
                    return true;
                }
            } catch (JSONException e) {
                return super.isTransientErrorBody(body);
            }
        }
        return super.isTransientErrorBody(body);
    }

    @Override
    protected String defaultPrompt() {
        return DefaultPrompts.WINDOW_ANALYSIS;
    }

    private String apiVersion() {
        String version = settings.getApiVersion();
        return version == null || version.isBlank() ? DEFAULT_API_VERSION : version;
    }
}
