package com.mossbauer.common.fitting;

import com.mossbauer.common.model.ParameterOverride;

/**
 * A named, optionally bounded fit parameter. Mutable only while the model is being
 * assembled; the optimizer reads it and never writes back.
 */
public final class ModelParameter {

    private final String name;
    private double value;
    private double min = Double.NEGATIVE_INFINITY;
    private double max = Double.POSITIVE_INFINITY;
    private boolean vary = true;

    ModelParameter(String name) {
        this.name = name;
    }

    void set(double value, double min, double max) {
        this.value = value;
        this.min = min;
        this.max = max;
    }

    /**
     * @throws IllegalArgumentException when the resulting bounds are inverted
     */
    void apply(ParameterOverride override) {
        double newMin = override.min() != null ? override.min() : min;
        double newMax = override.max() != null ? override.max() : max;
        if (newMin > newMax) {
            throw new IllegalArgumentException(String.format(
                "Invalid bounds for %s: min %s is greater than max %s", name, newMin, newMax));
        }
        min = newMin;
        max = newMax;
        if (override.value() != null) value = override.value();
        if (override.vary() != null)  vary = override.vary();
    }

    /** Value pulled inside {@code [min, max]}. */
    double clamp(double candidate) {
        return Math.max(min, Math.min(max, candidate));
    }

    public String name()   { return name; }
    public double value()  { return value; }
    public double min()    { return min; }
    public double max()    { return max; }
    public boolean vary()  { return vary; }

    public boolean hasMin() { return min != Double.NEGATIVE_INFINITY; }
    public boolean hasMax() { return max != Double.POSITIVE_INFINITY; }

    @Override
    public String toString() {
        return String.format("%s=%.5g [%s, %s]%s", name, value,
            hasMin() ? String.format("%.4g", min) : "-inf",
            hasMax() ? String.format("%.4g", max) : "+inf",
            vary ? "" : " fixed");
    }
}
