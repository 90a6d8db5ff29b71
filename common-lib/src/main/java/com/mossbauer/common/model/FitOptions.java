package com.mossbauer.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mossbauer.common.lineshape.LineShape;

import java.util.Map;

/**
 * Per-request fitting configuration.
 *
 * <ul>
 *   <li>{@code lineShape}          — peak family; Lorentzian when null</li>
 *   <li>{@code siteCount}          — explicit doublet count (1..6); auto-detected when null</li>
 *   <li>{@code overrides}          — parameter overrides keyed by name, e.g. {@code peak1_center}</li>
 *   <li>{@code baselineCorrection} — divide by the 95th percentile when the spectrum dips below 0.9</li>
 * </ul>
 */
public record FitOptions(
    @JsonProperty("model_type")          LineShape lineShape,
    @JsonProperty("n_sites")             Integer siteCount,
    @JsonProperty("custom_params")       Map<String, ParameterOverride> overrides,
    @JsonProperty("baseline_correction") Boolean baselineCorrection
) {
    public static final int MAX_EXPLICIT_SITES = 6;

    public FitOptions {
        if (lineShape == null) lineShape = LineShape.LORENTZIAN;
        if (overrides == null) overrides = Map.of();
        if (baselineCorrection == null) baselineCorrection = Boolean.TRUE;
        if (siteCount != null && (siteCount < 1 || siteCount > MAX_EXPLICIT_SITES)) {
            throw new IllegalArgumentException("n_sites must be between 1 and "
                + MAX_EXPLICIT_SITES + ", got " + siteCount);
        }
        overrides = Map.copyOf(overrides);
    }

    public static FitOptions defaults() {
        return new FitOptions(null, null, null, null);
    }

    public static FitOptions of(LineShape lineShape, Integer siteCount) {
        return new FitOptions(lineShape, siteCount, null, null);
    }

    public FitOptions withOverrides(Map<String, ParameterOverride> newOverrides) {
        return new FitOptions(lineShape, siteCount, newOverrides, baselineCorrection);
    }
}
