package com.phillippitts.windowanalysis.service.provider;

import com.phillippitts.windowanalysis.config.properties.ProviderProperties;
import com.phillippitts.windowanalysis.domain.AnalysisRequest;
import com.phillippitts.windowanalysis.exception.ProviderExceptionBuilder;
import com.phillippitts.windowanalysis.service.provider.transport.ProviderTransport;
import org.json.JSONArray;
import org.json.JSONObject;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Google Cloud Vision {@code images:annotate} adapter (object/label detection).
 *
 * <p>Unlike the language-model adapters this one sends no prompt. Detected labels and localized
 * objects are rendered as text lines such as {@code label: Casement window (confidence: 93%)}
 * so they go through the same normalization rules as free text.
 *
 * <p>Per-image failures come back as a typed {@code error} payload inside an HTTP 200 response,
 * carrying a gRPC status code.
 */
public class LabelDetectionAdapter extends AbstractProviderAdapter {

    /** gRPC codes worth retrying: CANCELLED, DEADLINE_EXCEEDED, RESOURCE_EXHAUSTED, ABORTED, INTERNAL, UNAVAILABLE. */
    private static final Set<Integer> TRANSIENT_RPC_CODES = Set.of(1, 4, 8, 10, 13, 14);

    public LabelDetectionAdapter(ProviderProperties.Settings settings, ProviderTransport transport) {
        super(settings, transport);
    }

    @Override
    public String providerId() {
        return ProviderIds.GOOGLE_VISION;
    }

    @Override
    public TranslatedRequest translateRequest(AnalysisRequest request, String credential) {
        int maxResults = settings.getMaxResults();
        JSONArray features = new JSONArray()
                .put(new JSONObject().put("type", "LABEL_DETECTION").put("maxResults", maxResults))
                .put(new JSONObject().put("type", "OBJECT_LOCALIZATION").put("maxResults", maxResults));

        JSONObject imageRequest = new JSONObject()
                .put("image", new JSONObject().put("content", request.payload().base64Data()))
                .put("features", features);

        JSONObject body = new JSONObject().put("requests", new JSONArray().put(imageRequest));

        String url = baseUrl() + "/v1/images:annotate?key=" + URLEncoder.encode(credential, StandardCharsets.UTF_8);
        return TranslatedRequest.post(url, Map.of("Content-Type", "application/json"), body.toString());
    }

    @Override
    protected String extractText(JSONObject response) {
        JSONObject topLevelError = response.optJSONObject("error");
        if (topLevelError != null) {
            throw typedError(topLevelError);
        }
        JSONArray responses = response.optJSONArray("responses");
        JSONObject first = responses != null ? responses.optJSONObject(0) : null;
        if (first == null) {
            return "";
        }
        JSONObject error = first.optJSONObject("error");
        if (error != null) {
            throw typedError(error);
        }

        StringBuilder text = new StringBuilder();
        appendAnnotations(text, "label", first.optJSONArray("labelAnnotations"), "description");
        appendAnnotations(text, "object", first.optJSONArray("localizedObjectAnnotations"), "name");
        return text.toString();
    }

    @Override
    protected boolean isTransientErrorBody(String body) {
        if (body != null && body.contains("RESOURCE_EXHAUSTED")) {
            return true;
        }
        return super.isTransientErrorBody(body);
    }

    @Override
    protected String defaultPrompt() {
        return "";
    }

    private RuntimeException typedError(JSONObject error) {
        int code = error.optInt("code", -1);
        return ProviderExceptionBuilder.create("Provider reported an error")
                .provider(providerId())
                .retryableIf(TRANSIENT_RPC_CODES.contains(code) || containsTransientMarker(error.optString("message")))
                .metadata("rpcCode", code)
                .metadata("errorMessage", error.optString("message", null))
                .build();
    }

    private static void appendAnnotations(StringBuilder text, String kind, JSONArray annotations, String nameField) {
        if (annotations == null) {
            return;
        }
        for (int i = 0; i < annotations.length(); i++) {
            JSONObject annotation = annotations.optJSONObject(i);
            if (annotation == null) {
                continue;
            }
            String name = annotation.optString(nameField, "").trim();
            if (name.isEmpty()) {
                continue;
            }
            long pct = Math.round(annotation.optDouble("score", 0.0) * 100);
            text.append(String.format(Locale.ROOT, "%s: %s (confidence: %d%%)\n", kind, name, pct));
        }
    }
}
