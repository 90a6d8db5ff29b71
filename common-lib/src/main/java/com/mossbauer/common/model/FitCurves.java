package com.mossbauer.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Velocity-indexed curves for chart construction. {@code components} maps each
 * component prefix ({@code peak1_}, ...) to its positive line profile; the total fit is
 * {@code baseline − Σ components}. {@code residuals} are {@code experimental − totalFit}.
 */
public record FitCurves(
    @JsonProperty("velocity")     double[] velocity,
    @JsonProperty("experimental") double[] experimental,
    @JsonProperty("total_fit")    double[] totalFit,
    @JsonProperty("components")   Map<String, double[]> components,
    @JsonProperty("residuals")    double[] residuals
) {}
