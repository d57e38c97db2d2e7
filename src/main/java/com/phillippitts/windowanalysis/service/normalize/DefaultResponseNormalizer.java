package com.phillippitts.windowanalysis.service.normalize;

import com.phillippitts.windowanalysis.config.properties.NormalizerProperties;
import com.phillippitts.windowanalysis.domain.Dimensions;
import com.phillippitts.windowanalysis.domain.FrameMaterial;
import com.phillippitts.windowanalysis.domain.NormalizedResult;
import com.phillippitts.windowanalysis.domain.Recommendation;
import com.phillippitts.windowanalysis.domain.WindowCategory;
import com.phillippitts.windowanalysis.domain.WindowCondition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Rule-table based {@link ResponseNormalizer}.
 *
 * <p>Pipeline: flatten JSON (if any) → categorical fields via {@link ExtractionRules} (first match
 * wins) → dimensions → window count → recommendations → confidence.
 *
 * <p>Stateless and thread-safe.
 */
public class DefaultResponseNormalizer implements ResponseNormalizer {

    private static final Logger LOG = LogManager.getLogger(DefaultResponseNormalizer.class);

    private final DimensionExtractor dimensionExtractor;
    private final RecommendationExtractor recommendationExtractor;
    private final ConfidenceScorer confidenceScorer;

    public DefaultResponseNormalizer(NormalizerProperties properties) {
        this(new DimensionExtractor(properties),
                new RecommendationExtractor(properties.getMinRecommendationLength()),
                new ConfidenceScorer(properties));
    }

    public DefaultResponseNormalizer(DimensionExtractor dimensionExtractor,
                                     RecommendationExtractor recommendationExtractor,
                                     ConfidenceScorer confidenceScorer) {
        this.dimensionExtractor = Objects.requireNonNull(dimensionExtractor, "dimensionExtractor");
        this.recommendationExtractor = Objects.requireNonNull(recommendationExtractor, "recommendationExtractor");
        this.confidenceScorer = Objects.requireNonNull(confidenceScorer, "confidenceScorer");
    }

    @Override
    public NormalizedResult normalize(String providerId, String rawResponse) {
        Objects.requireNonNull(providerId, "providerId");
        String text = StructuredResponseFlattener.flatten(rawResponse);

        WindowCategory category = ExtractionRules.CATEGORY.firstMatch(text);
        List<WindowCategory> allCategories = ExtractionRules.CATEGORY.allMatches(text);
        FrameMaterial material = ExtractionRules.MATERIAL.firstMatch(text);
        List<FrameMaterial> allMaterials = ExtractionRules.MATERIAL.allMatches(text);
        WindowCondition condition = ExtractionRules.CONDITION.firstMatch(text);
        Dimensions dimensions = dimensionExtractor.extract(text).orElse(null);
        OptionalInt stated = WindowCountExtractor.extract(text);
        Integer windowCount = stated.isPresent() ? stated.getAsInt() : null;
        List<Recommendation> recommendations = recommendationExtractor.extract(text);

        OptionalInt explicit = confidenceScorer.explicitConfidence(text);
        int confidence = explicit.isPresent()
                ? explicit.getAsInt()
                : confidenceScorer.derivedConfidence(category.isKnown(), material.isKnown(),
                        condition.isKnown(), dimensions != null, !recommendations.isEmpty());

        NormalizedResult result = new NormalizedResult(providerId, category, material, condition, dimensions,
                windowCount, recommendations, allCategories, allMaterials, explicit.isPresent(), confidence);

        LOG.debug("Normalized provider={} category={} material={} condition={} dimensions={} windows={}{} recs={} "
                        + "confidence={}{}",
                providerId, category, material, condition, dimensions, result.windowsDetected(),
                windowCount == null ? " (assumed)" : "", recommendations.size(), confidence,
                explicit.isPresent() ? " (explicit)" : "");
        return result;
    }
}
