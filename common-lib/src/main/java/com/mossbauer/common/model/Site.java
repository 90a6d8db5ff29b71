package com.mossbauer.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One chemically distinct absorbing site, recovered from a fitted doublet.
 * All parameters are in mm/s except {@code relativeArea} (percent) and
 * {@code hyperfineField} (tesla, absent for doublet fits).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Site(
    @JsonProperty("isomer_shift")          double isomerShift,
    @JsonProperty("quadrupole_splitting")  double quadrupoleSplitting,
    @JsonProperty("line_width")            double lineWidth,
    @JsonProperty("relative_area")         double relativeArea,
    @JsonProperty("site_type")             String siteType,
    @JsonProperty("hyperfine_field")       Double hyperfineField
) {
    public static Site doublet(double isomerShift, double quadrupoleSplitting,
                               double lineWidth, double relativeArea, String siteType) {
        return new Site(isomerShift, quadrupoleSplitting, lineWidth, relativeArea, siteType, null);
    }
}
