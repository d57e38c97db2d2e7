package com.phillippitts.windowanalysis.service.provider;

import com.phillippitts.windowanalysis.config.properties.ProviderProperties;
import com.phillippitts.windowanalysis.service.provider.transport.ProviderTransport;
import com.phillippitts.windowanalysis.testutil.TestRequests;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.Mockito.mock;

class LabelDetectionAdapterTest {

    private LabelDetectionAdapter adapter;

    @BeforeEach
    void setUp() {
        ProviderProperties.Settings settings = new ProviderProperties.Settings();
        settings.setBaseUrl("https://vision.example.com/");
        settings.setMaxResults(5);
        adapter = new LabelDetectionAdapter(settings, mock(ProviderTransport.class));
    }

    @Test
    void requestsLabelAndObjectDetectionWithKeyInQuery() {
        TranslatedRequest translated = adapter.translateRequest(TestRequests.request("req-1", "google-vision"), "k/1");

        assertThat(translated.url()).isEqualTo("https://vision.example.com/v1/images:annotate?key=k%2F1");
        assertThat(translated.toString()).doesNotContain("k%2F1");
        JSONObject req = new JSONObject(translated.body()).getJSONArray("requests").getJSONObject(0);
        assertThat(req.getJSONObject("image").getString("content")).isEqualTo(TestRequests.IMAGE.base64Data());
        assertThat(req.getJSONArray("features").getJSONObject(0).getString("type")).isEqualTo("LABEL_DETECTION");
        assertThat(req.getJSONArray("features").getJSONObject(1).getInt("maxResults")).isEqualTo(5);
    }

    @Test
    void rendersAnnotationsAsLabelLines() {
        String body = """
                {"responses":[{
                  "labelAnnotations":[{"description":"Casement window","score":0.93},{"description":"Wood","score":0.714}],
                  "localizedObjectAnnotations":[{"name":"Window","score":0.88}]
                }]}
                """;

        assertThat(adapter.translateResponse(body)).isEqualTo(
                "label: Casement window (confidence: 93%)\nlabel: Wood (confidence: 71%)\nobject: Window (confidence: 88%)");
    }

    @Test
    void perImageErrorIsClassifiedByRpcCode() {
        Throwable unavailable = catchThrowable(() -> adapter.translateResponse(
                "{\"responses\":[{\"error\":{\"code\":14,\"message\":\"Service unavailable\"}}]}"));
        Throwable invalid = catchThrowable(() -> adapter.translateResponse(
                "{\"responses\":[{\"error\":{\"code\":3,\"message\":\"Bad image data\"}}]}"));

        assertThat(adapter.isTransientFailure(unavailable)).isTrue();
        assertThat(adapter.isTransientFailure(invalid)).isFalse();
    }

    @Test
    void sendsNoPrompt() {
        assertThat(adapter.defaultPrompt()).isEmpty();
    }
}
