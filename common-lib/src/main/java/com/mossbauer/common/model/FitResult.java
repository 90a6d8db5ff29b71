package com.mossbauer.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mossbauer.common.lineshape.LineShape;

import java.util.List;

/**
 * Immutable outcome of one analysis run: the recovered sites plus goodness-of-fit
 * statistics. Consumed by the interpreter and the response layer; never mutated.
 *
 * <p>{@code parameters} and {@code curves} are optional on input so that a result
 * posted back for interpretation only needs the sites and statistics.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FitResult(
    @JsonProperty("sites")                List<Site> sites,
    @JsonProperty("chi_squared")          double chiSquared,
    @JsonProperty("reduced_chi_squared")  double reducedChiSquared,
    @JsonProperty("n_data_points")        int nDataPoints,
    @JsonProperty("n_variables")          int nVariables,
    @JsonProperty("fit_report")           String fitReport,
    @JsonProperty("model_type")           LineShape lineShape,
    @JsonProperty("parameters")           List<FittedParameter> parameters,
    @JsonProperty("curves")               FitCurves curves
) {
    public FitResult {
        sites = sites == null ? List.of() : List.copyOf(sites);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        if (lineShape == null) lineShape = LineShape.LORENTZIAN;
    }

    public int siteCount() {
        return sites.size();
    }

    /** Same result without curve data, for responses that carry curves separately. */
    public FitResult withoutCurves() {
        return new FitResult(sites, chiSquared, reducedChiSquared, nDataPoints, nVariables,
            fitReport, lineShape, parameters, null);
    }

    public double totalRelativeArea() {
        return sites.stream().mapToDouble(Site::relativeArea).sum();
    }
}
