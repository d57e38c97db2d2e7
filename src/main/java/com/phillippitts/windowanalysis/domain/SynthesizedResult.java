package com.phillippitts.windowanalysis.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Consensus result for one analysis request.
 *
 * <p>Each field carries the provider it was taken from. {@code partial} is true iff fewer
 * providers contributed than were requested.
 *
 * @param requestId             id of the resolved request
 * @param category              consensus window category with provenance
 * @param material              consensus frame material with provenance
 * @param condition             consensus condition with provenance
 * @param dimensions            selected dimensions with provenance (value {@code null} when absent)
 * @param windowCount           windows detected with provenance; an unattributed one when nobody stated a count
 * @param recommendations       merged recommendations, each with provenance
 * @param aggregateConfidence   mean confidence of contributing providers (0..100)
 * @param qualityScore          completeness of the synthesized fields (0..100)
 * @param requestedProviders    providers the request asked for, in request order
 * @param contributingProviders providers that contributed, in priority order
 * @param failedProviders       providers that did not contribute, with the reason
 * @param partial               true iff at least one requested provider did not contribute
 * @param completedAt           when synthesis ran
 */
public record SynthesizedResult(
        String requestId,
        FieldValue<WindowCategory> category,
        FieldValue<FrameMaterial> material,
        FieldValue<WindowCondition> condition,
        FieldValue<Dimensions> dimensions,
        FieldValue<Integer> windowCount,
        List<FieldValue<Recommendation>> recommendations,
        int aggregateConfidence,
        int qualityScore,
        List<String> requestedProviders,
        List<String> contributingProviders,
        Map<String, FailureReason> failedProviders,
        boolean partial,
        Instant completedAt
) {
    public SynthesizedResult {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(material, "material");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(dimensions, "dimensions");
        Objects.requireNonNull(windowCount, "windowCount");
        recommendations = List.copyOf(recommendations);
        requestedProviders = List.copyOf(requestedProviders);
        contributingProviders = List.copyOf(contributingProviders);
        failedProviders = Map.copyOf(failedProviders);
        if (aggregateConfidence < 0 || aggregateConfidence > 100) {
            throw new IllegalArgumentException(
                    "aggregateConfidence must be between 0 and 100, got: " + aggregateConfidence);
        }
        if (qualityScore < 0 || qualityScore > 100) {
            throw new IllegalArgumentException("qualityScore must be between 0 and 100, got: " + qualityScore);
        }
        Objects.requireNonNull(completedAt, "completedAt");
    }
}
