package com.mossbauer.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Caller-supplied replacement for any subset of a model parameter's initial value,
 * bounds and vary flag. Null fields leave the builder's default in place.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParameterOverride(
    @JsonProperty("value") Double value,
    @JsonProperty("min")   Double min,
    @JsonProperty("max")   Double max,
    @JsonProperty("vary")  Boolean vary
) {
    public static ParameterOverride value(double value) {
        return new ParameterOverride(value, null, null, null);
    }

    public static ParameterOverride fixed(double value) {
        return new ParameterOverride(value, null, null, Boolean.FALSE);
    }

    public static ParameterOverride bounds(double min, double max) {
        return new ParameterOverride(null, min, max, null);
    }
}
