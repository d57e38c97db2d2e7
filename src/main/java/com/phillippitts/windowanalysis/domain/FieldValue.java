package com.phillippitts.windowanalysis.domain;

/**
 * A synthesized value together with the provider it was taken from.
 *
 * @param value    selected value (an {@code UNKNOWN} constant or {@code null} when nobody reported one)
 * @param provider provider the value came from, {@code null} when the value is a fallback
 * @param <T>      value type
 */
public record FieldValue<T>(T value, String provider) {

    public static <T> FieldValue<T> of(T value, String provider) {
        return new FieldValue<>(value, provider);
    }

    public static <T> FieldValue<T> unattributed(T value) {
        return new FieldValue<>(value, null);
    }

    public boolean isAttributed() {
        return provider != null;
    }
}
