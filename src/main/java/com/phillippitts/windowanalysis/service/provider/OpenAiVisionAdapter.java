package com.phillippitts.windowanalysis.service.provider;

import com.phillippitts.windowanalysis.config.properties.ProviderProperties;
import com.phillippitts.windowanalysis.domain.AnalysisRequest;
import com.phillippitts.windowanalysis.exception.ProviderExceptionBuilder;
import com.phillippitts.windowanalysis.service.provider.transport.ProviderTransport;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OpenAI chat-completions adapter for vision-capable models.
 *
 * <p>The image is embedded as an {@code image_url} part holding a {@code data:} URL; the reply
 * is {@code choices[0].message.content}. Errors surface through the HTTP status, with a
 * descriptive {@code error} object in the body.
 */
public class OpenAiVisionAdapter extends AbstractProviderAdapter {

    public OpenAiVisionAdapter(ProviderProperties.Settings settings, ProviderTransport transport) {
        super(settings, transport);
    }

    @Override
    public String providerId() {
        return ProviderIds.OPENAI;
    }

    @Override
    public TranslatedRequest translateRequest(AnalysisRequest request, String credential) {
        JSONArray content = new JSONArray()
                .put(new JSONObject().put("type", "text").put("text", promptFor(request)))
                .put(new JSONObject()
                        .put("type", "image_url")
                        .put("image_url", new JSONObject().put("url", request.payload().toDataUrl())));

        JSONObject body = new JSONObject()
                .put("model", settings.getModel())
                .put("max_tokens", settings.getMaxTokens())
                .put("temperature", settings.getTemperature())
                .put("messages", new JSONArray().put(new JSONObject().put("role", "user").put("content", content)));

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + credential);
        headers.put("Content-Type", "application/json");

        return TranslatedRequest.post(baseUrl() + "/v1/chat/completions", headers, body.toString());
    }

    @Override
    protected String extractText(JSONObject response) {
        JSONObject error = response.optJSONObject("error");
        if (error != null) {
            String message = error.optString("message", "");
            throw ProviderExceptionBuilder.create("Provider reported an error")
                    .provider(providerId())
                    .retryableIf(containsTransientMarker(message))
                    .metadata("errorType", error.optString("type", null))
                    .metadata("errorMessage", message)
                    .build();
        }

        JSONArray choices = response.optJSONArray("choices");
        if (choices == null || choices.isEmpty()) {
            return "";
        }
        JSONObject first = choices.optJSONObject(0);
        JSONObject message = first != null ? first.optJSONObject("message") : null;
        return message != null ? message.optString("content", "") : "";
    }

    @Override
    protected String defaultPrompt() {
        return DefaultPrompts.WINDOW_ANALYSIS;
    }
}
