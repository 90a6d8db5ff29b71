package com.mossbauer.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Converged value of one model parameter. {@code stderr} is null for fixed parameters
 * and when the covariance matrix could not be inverted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FittedParameter(
    @JsonProperty("name")   String name,
    @JsonProperty("value")  double value,
    @JsonProperty("stderr") Double stderr,
    @JsonProperty("min")    Double min,
    @JsonProperty("max")    Double max,
    @JsonProperty("vary")   boolean vary
) {}
