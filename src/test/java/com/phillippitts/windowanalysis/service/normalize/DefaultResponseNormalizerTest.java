package com.phillippitts.windowanalysis.service.normalize;

import com.phillippitts.windowanalysis.config.properties.NormalizerProperties;
import com.phillippitts.windowanalysis.domain.Dimensions;
import com.phillippitts.windowanalysis.domain.FrameMaterial;
import com.phillippitts.windowanalysis.domain.NormalizedResult;
import com.phillippitts.windowanalysis.domain.Recommendation;
import com.phillippitts.windowanalysis.domain.WindowCategory;
import com.phillippitts.windowanalysis.domain.WindowCondition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultResponseNormalizerTest {

    private static final String FREE_TEXT = """
            This is a double-hung window with a vinyl frame in good condition.
            Approximate size: 30 x 48 inches.

            Recommendations: Replace worn weatherstripping soon. Schedule a professional measurement before ordering.
            """;

    private static final String STRUCTURED = """
            {"window_type":"casement","frame_material":"wood","condition":"fair","confidence":0.82,
             "recommendations":["Install new hinges for better operation","Repaint the frame soon"]}
            """;

    private DefaultResponseNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new DefaultResponseNormalizer(new NormalizerProperties());
    }

    @Test
    void extractsEveryFieldFromFreeText() {
        NormalizedResult r = normalizer.normalize("anthropic", FREE_TEXT);

        assertThat(r.providerId()).isEqualTo("anthropic");
        assertThat(r.category()).isEqualTo(WindowCategory.DOUBLE_HUNG);
        assertThat(r.material()).isEqualTo(FrameMaterial.VINYL);
        assertThat(r.condition()).isEqualTo(WindowCondition.GOOD);
        assertThat(r.dimensions()).isEqualTo(new Dimensions(30, 48));
        assertThat(r.recommendations()).extracting(Recommendation::text)
                .containsExactly("Replace worn weatherstripping soon",
                        "Schedule a professional measurement before ordering");
        assertThat(r.recommendations()).extracting(Recommendation::category)
                .containsExactly(Recommendation.Category.GENERAL, Recommendation.Category.MEASUREMENT);
        assertThat(r.recommendations()).extracting(Recommendation::priority)
                .containsExactly(Recommendation.Priority.MEDIUM, Recommendation.Priority.LOW);
        // derived: 40 base + 15 + 15 + 10 + 10 + 5, capped at 95
        assertThat(r.explicitConfidence()).isFalse();
        assertThat(r.confidence()).isEqualTo(95);
        assertThat(r.contributes()).isTrue();
    }

    @Test
    void flattensJsonResponsesThroughTheSameRules() {
        NormalizedResult r = normalizer.normalize("openai", STRUCTURED);

        assertThat(r.category()).isEqualTo(WindowCategory.CASEMENT);
        assertThat(r.material()).isEqualTo(FrameMaterial.WOOD);
        assertThat(r.condition()).isEqualTo(WindowCondition.FAIR);
        assertThat(r.explicitConfidence()).isTrue();
        assertThat(r.confidence()).isEqualTo(82);
        assertThat(r.recommendations()).extracting(Recommendation::text)
                .containsExactly("Install new hinges for better operation", "Repaint the frame soon");
        assertThat(r.recommendations()).extracting(Recommendation::category)
                .containsExactly(Recommendation.Category.INSTALLATION, Recommendation.Category.MATERIAL);
    }

    @Test
    void fencedJsonIsUnwrapped() {
        NormalizedResult r = normalizer.normalize("anthropic", "```json\n" + STRUCTURED.trim() + "\n```");
        assertThat(r.category()).isEqualTo(WindowCategory.CASEMENT);
        assertThat(r.confidence()).isEqualTo(82);
    }

    @Test
    void jsonKeyOrderDoesNotChangeResult() {
        String reordered = """
                {"recommendations":["Install new hinges for better operation","Repaint the frame soon"],
                 "confidence":0.82,"condition":"fair","frame_material":"wood","window_type":"casement"}
                """;
        NormalizedResult a = normalizer.normalize("openai", STRUCTURED);
        NormalizedResult b = normalizer.normalize("openai", reordered);
        assertThat(b).isEqualTo(a);
    }

    @Test
    void normalizationIsIdempotent() {
        assertThat(normalizer.normalize("anthropic", FREE_TEXT))
                .isEqualTo(normalizer.normalize("anthropic", FREE_TEXT));
    }

    @Test
    void averagesExplicitPercentFigures() {
        String labels = "label: Casement window (confidence: 93%)\nlabel: Wood (confidence: 71%)\n";
        NormalizedResult r = normalizer.normalize("google-vision", labels);

        assertThat(r.category()).isEqualTo(WindowCategory.CASEMENT);
        assertThat(r.material()).isEqualTo(FrameMaterial.WOOD);
        assertThat(r.confidence()).isEqualTo(82);
        assertThat(r.explicitConfidence()).isTrue();
    }

    @Test
    void firstMatchingRuleWinsAndAllMatchesAreKept() {
        NormalizedResult r = normalizer.normalize("anthropic",
                "A bay window flanked by two casement units; aluminum and vinyl components.");

        assertThat(r.category()).isEqualTo(WindowCategory.CASEMENT);
        assertThat(r.detectedCategories()).containsExactly(WindowCategory.CASEMENT, WindowCategory.BAY);
        assertThat(r.material()).isEqualTo(FrameMaterial.VINYL);
        assertThat(r.detectedMaterials()).containsExactly(FrameMaterial.VINYL, FrameMaterial.ALUMINUM);
    }

    @Test
    void extractsStatedWindowCountFromTextAndJson() {
        NormalizedResult text = normalizer.normalize("anthropic", "Window Count: 4\nAll are casement units.");
        NormalizedResult json = normalizer.normalize("openai", "{\"window_count\":3,\"window_type\":\"bay\"}");

        assertThat(text.windowCount()).isEqualTo(4);
        assertThat(text.windowsDetected()).isEqualTo(4);
        assertThat(json.windowCount()).isEqualTo(3);
    }

    @Test
    void missingWindowCountIsAssumedOneButNotStated() {
        NormalizedResult r = normalizer.normalize("anthropic", FREE_TEXT);

        assertThat(r.hasWindowCount()).isFalse();
        assertThat(r.windowsDetected()).isEqualTo(NormalizedResult.DEFAULT_WINDOW_COUNT);
    }

    @Test
    void responseWithNothingUsableDoesNotContribute() {
        NormalizedResult r = normalizer.normalize("openai", "I cannot tell anything from this image.");

        assertThat(r.category()).isEqualTo(WindowCategory.UNKNOWN);
        assertThat(r.material()).isEqualTo(FrameMaterial.UNKNOWN);
        assertThat(r.condition()).isEqualTo(WindowCondition.UNKNOWN);
        assertThat(r.dimensions()).isNull();
        assertThat(r.windowCount()).isNull();
        assertThat(r.recommendations()).isEmpty();
        assertThat(r.contributes()).isFalse();
        assertThat(r.confidence()).isEqualTo(40);
    }

    @Test
    void nullAndEmptyResponsesNormalizeToUnknown() {
        assertThat(normalizer.normalize("openai", null).contributes()).isFalse();
        assertThat(normalizer.normalize("openai", "").contributes()).isFalse();
    }
}
