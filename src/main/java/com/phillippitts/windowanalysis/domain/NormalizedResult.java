package com.phillippitts.windowanalysis.domain;

import java.util.List;
import java.util.Objects;

/**
 * Canonical fields extracted from one provider's response.
 *
 * <p>Presence of each field is derived from its value: an {@code UNKNOWN} enum, a {@code null}
 * dimension or window count, or an empty recommendation list means the provider said nothing usable about it.
 * A result {@linkplain #contributes() contributes} to synthesis when at least one field is
 * present or the response stated an explicit confidence figure.
 *
 * @param providerId          provider that produced the response
 * @param category            first window category matched in rule order
 * @param material            first frame material matched in rule order
 * @param condition           first condition matched in rule order
 * @param dimensions          plausible width/height in inches, or {@code null}
 * @param windowCount         window count stated in the response, or {@code null}
 * @param recommendations     recommendation fragments in response order
 * @param detectedCategories  every category matched, in rule order
 * @param detectedMaterials   every material matched, in rule order
 * @param explicitConfidence  true if the confidence came from figures stated in the response
 * @param confidence          overall confidence 0..100
 */
public record NormalizedResult(
        String providerId,
        WindowCategory category,
        FrameMaterial material,
        WindowCondition condition,
        Dimensions dimensions,
        Integer windowCount,
        List<Recommendation> recommendations,
        List<WindowCategory> detectedCategories,
        List<FrameMaterial> detectedMaterials,
        boolean explicitConfidence,
        int confidence
) {

    /** Windows assumed in the photo when the response states no count. */
    public static final int DEFAULT_WINDOW_COUNT = 1;

    public NormalizedResult {
        Objects.requireNonNull(providerId, "providerId");
        category = category == null ? WindowCategory.UNKNOWN : category;
        material = material == null ? FrameMaterial.UNKNOWN : material;
        condition = condition == null ? WindowCondition.UNKNOWN : condition;
        if (windowCount != null && windowCount < 0) {
            throw new IllegalArgumentException("windowCount must be >= 0, got: " + windowCount);
        }
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        detectedCategories = detectedCategories == null ? List.of() : List.copyOf(detectedCategories);
        detectedMaterials = detectedMaterials == null ? List.of() : List.copyOf(detectedMaterials);
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be between 0 and 100, got: " + confidence);
        }
    }

    public boolean hasCategory() {
        return category.isKnown();
    }

    public boolean hasMaterial() {
        return material.isKnown();
    }

    public boolean hasCondition() {
        return condition.isKnown();
    }

    public boolean hasDimensions() {
        return dimensions != null;
    }

    public boolean hasWindowCount() {
        return windowCount != null;
    }

    /**
     * Stated window count, or {@link #DEFAULT_WINDOW_COUNT} when the response did not state it.
     */
    public int windowsDetected() {
        return windowCount == null ? DEFAULT_WINDOW_COUNT : windowCount;
    }

    public boolean hasRecommendations() {
        return !recommendations.isEmpty();
    }

    /**
     * True when any canonical field is present or an explicit confidence was reported.
     */
    public boolean contributes() {
        return hasCategory() || hasMaterial() || hasCondition() || hasDimensions()
                || hasWindowCount() || hasRecommendations() || explicitConfidence;
    }
}
