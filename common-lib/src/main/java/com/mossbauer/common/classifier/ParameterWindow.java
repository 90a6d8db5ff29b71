package com.mossbauer.common.classifier;

/**
 * Closed interval {@code [min, max]} in mm/s. Both ends are inclusive.
 */
public record ParameterWindow(double min, double max) {

    public static final ParameterWindow ANY =
        new ParameterWindow(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);

    public ParameterWindow {
        if (min > max) throw new IllegalArgumentException("min > max: " + min + " > " + max);
    }

    public static ParameterWindow of(double min, double max) {
        return new ParameterWindow(min, max);
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    @Override
    public String toString() {
        if (this.equals(ANY)) return "any";
        return String.format("[%.2f, %.2f]", min, max);
    }
}
