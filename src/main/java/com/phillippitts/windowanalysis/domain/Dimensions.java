package com.phillippitts.windowanalysis.domain;

/**
 * Estimated window size in inches.
 *
 * <p>Plausibility is enforced by the normalizer, not here: a value outside the accepted range
 * is discarded before a {@code Dimensions} is ever built.
 *
 * @param widthInches  estimated width
 * @param heightInches estimated height
 */
public record Dimensions(double widthInches, double heightInches) {

    public Dimensions {
        if (!(widthInches > 0) || !(heightInches > 0)) {
            throw new IllegalArgumentException(
                    "Dimensions must be positive, got: " + widthInches + " x " + heightInches);
        }
    }
}
