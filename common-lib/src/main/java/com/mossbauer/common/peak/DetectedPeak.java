package com.mossbauer.common.peak;

/**
 * A local maximum of the inverted signal: sample index and depth below the baseline.
 */
public record DetectedPeak(int index, double height) {}
