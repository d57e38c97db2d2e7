package com.phillippitts.windowanalysis.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Weights and plausibility bounds used when normalizing provider responses.
 *
 * <p>When a response states no confidence figure, confidence is
 * {@code baseConfidence} plus one bonus per extracted field, capped at {@code maxConfidence}.
 */
@Validated
@ConfigurationProperties(prefix = "analysis.normalizer")
public class NormalizerProperties {

    @Min(0) @Max(100)
    private int baseConfidence = 40;

    @Min(0) @Max(100)
    private int categoryBonus = 15;

    @Min(0) @Max(100)
    private int materialBonus = 15;

    @Min(0) @Max(100)
    private int conditionBonus = 10;

    @Min(0) @Max(100)
    private int dimensionsBonus = 10;

    @Min(0) @Max(100)
    private int recommendationBonus = 5;

    @Min(0) @Max(100)
    private int maxConfidence = 95;

    /** Recommendation fragments this short or shorter are dropped. */
    @Min(0)
    private int minRecommendationLength = 10;

    @Positive
    private double minWidthInches = 6;

    @Positive
    private double maxWidthInches = 120;

    @Positive
    private double minHeightInches = 6;

    @Positive
    private double maxHeightInches = 144;

    public int getBaseConfidence() {
        return baseConfidence;
    }

    public void setBaseConfidence(int baseConfidence) {
        this.baseConfidence = baseConfidence;
    }

    public int getCategoryBonus() {
        return categoryBonus;
    }

    public void setCategoryBonus(int categoryBonus) {
        this.categoryBonus = categoryBonus;
    }

    public int getMaterialBonus() {
        return materialBonus;
    }

    public void setMaterialBonus(int materialBonus) {
        this.materialBonus = materialBonus;
    }

    public int getConditionBonus() {
        return conditionBonus;
    }

    public void setConditionBonus(int conditionBonus) {
        this.conditionBonus = conditionBonus;
    }

    public int getDimensionsBonus() {
        return dimensionsBonus;
    }

    public void setDimensionsBonus(int dimensionsBonus) {
        this.dimensionsBonus = dimensionsBonus;
    }

    public int getRecommendationBonus() {
        return recommendationBonus;
    }

    public void setRecommendationBonus(int recommendationBonus) {
        this.recommendationBonus = recommendationBonus;
    }

    public int getMaxConfidence() {
        return maxConfidence;
    }

    public void setMaxConfidence(int maxConfidence) {
        this.maxConfidence = maxConfidence;
    }

    public int getMinRecommendationLength() {
        return minRecommendationLength;
    }

    public void setMinRecommendationLength(int minRecommendationLength) {
        this.minRecommendationLength = minRecommendationLength;
    }

    public double getMinWidthInches() {
        return minWidthInches;
    }

    public void setMinWidthInches(double minWidthInches) {
        this.minWidthInches = minWidthInches;
    }

    public double getMaxWidthInches() {
        return maxWidthInches;
    }

    public void setMaxWidthInches(double maxWidthInches) {
        this.maxWidthInches = maxWidthInches;
    }

    public double getMinHeightInches() {
        return minHeightInches;
    }

    public void setMinHeightInches(double minHeightInches) {
        this.minHeightInches = minHeightInches;
    }

    public double getMaxHeightInches() {
        return maxHeightInches;
    }

    public void setMaxHeightInches(double maxHeightInches) {
        this.maxHeightInches = maxHeightInches;
    }
}
