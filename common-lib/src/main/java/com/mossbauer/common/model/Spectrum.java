package com.mossbauer.common.model;

import java.util.Arrays;

/**
 * A loaded, validated and normalized spectrum: paired velocity (mm/s) and relative
 * transmission samples. Immutable; both accessors return copies.
 */
public final class Spectrum {

    public static final int MIN_POINTS = 10;

    private final double[] velocity;
    private final double[] absorption;

    private Spectrum(double[] velocity, double[] absorption) {
        this.velocity = velocity;
        this.absorption = absorption;
    }

    /**
     * @throws IllegalArgumentException when the arrays differ in length, hold fewer than
     *                                  {@value #MIN_POINTS} samples, or contain non-finite values
     */
    public static Spectrum of(double[] velocity, double[] absorption) {
        if (velocity == null || absorption == null) {
            throw new IllegalArgumentException("velocity and absorption must not be null");
        }
        if (velocity.length != absorption.length) {
            throw new IllegalArgumentException("velocity and absorption lengths differ: "
                + velocity.length + " vs " + absorption.length);
        }
        if (velocity.length < MIN_POINTS) {
            throw new IllegalArgumentException("at least " + MIN_POINTS + " points required, got " + velocity.length);
        }
        for (int i = 0; i < velocity.length; i++) {
            if (!Double.isFinite(velocity[i]) || !Double.isFinite(absorption[i])) {
                throw new IllegalArgumentException("non-finite sample at index " + i);
            }
        }
        return new Spectrum(velocity.clone(), absorption.clone());
    }

    public int size() {
        return velocity.length;
    }

    public double[] velocity() {
        return velocity.clone();
    }

    public double[] absorption() {
        return absorption.clone();
    }

    public double velocityAt(int i) {
        return velocity[i];
    }

    public double absorptionAt(int i) {
        return absorption[i];
    }

    public double minVelocity() {
        return Arrays.stream(velocity).min().orElse(0.0);
    }

    public double maxVelocity() {
        return Arrays.stream(velocity).max().orElse(0.0);
    }

    public double minAbsorption() {
        return Arrays.stream(absorption).min().orElse(0.0);
    }

    public double maxAbsorption() {
        return Arrays.stream(absorption).max().orElse(0.0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Spectrum other)) return false;
        return Arrays.equals(velocity, other.velocity) && Arrays.equals(absorption, other.absorption);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(velocity) + Arrays.hashCode(absorption);
    }

    @Override
    public String toString() {
        return String.format("Spectrum[n=%d, v=%.3f..%.3f]", size(), minVelocity(), maxVelocity());
    }
}
