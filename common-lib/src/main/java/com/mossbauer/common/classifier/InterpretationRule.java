package com.mossbauer.common.classifier;

/**
 * One row of the site classification table: if the isomer shift and quadrupole
 * splitting both fall inside their windows, the site gets {@code label}.
 * {@code commentary} is the one-sentence explanation used in rule-based summaries.
 */
public record InterpretationRule(
    String label,
    ParameterWindow isomerShift,
    ParameterWindow quadrupoleSplitting,
    String commentary
) {
    public boolean matches(double isomerShiftValue, double quadrupoleSplittingValue) {
        return isomerShift.contains(isomerShiftValue) && quadrupoleSplitting.contains(quadrupoleSplittingValue);
    }
}
