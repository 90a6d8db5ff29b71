package com.mossbauer.common.classifier;

import com.mossbauer.common.model.Site;

import java.util.List;
import java.util.Optional;

/**
 * Canonical, ordered site classification table (values in mm/s relative to α-Fe).
 *
 * <p>Rules are evaluated top to bottom and the first match wins; windows are inclusive
 * at both ends, so a value on a shared edge belongs to the earlier rule. The specific
 * coordination rules come first, followed by two broad oxidation-state catch-alls.
 *
 * <pre>
 *  #  label                          isomer shift     quadrupole splitting
 *  1  Fe³⁺ high-spin (tetrahedral)   [0.15, 0.30]     [0.00, 1.00]
 *  2  Fe³⁺ high-spin (octahedral)    [0.30, 0.55]     [0.00, 1.50]
 *  3  Fe²⁺ high-spin (tetrahedral)   [0.85, 1.05]     [1.50, 3.00]
 *  4  Fe²⁺ high-spin (octahedral)    [1.05, 1.50]     [1.50, 3.50]
 *  5  Low-spin Fe²⁺/Fe³⁺             [-0.20, 0.15]    [0.00, 2.00]
 *  6  Fe³⁺                           [-0.20, 0.60]    any
 *  7  Fe²⁺                           [0.60, 1.50]     any
 *     Unknown                        otherwise
 * </pre>
 *
 * <p>Both the parameter extractor and the rule-based interpreter read this table, so
 * a site is labelled identically wherever it is classified.
 */
public final class SiteClassifier {

    public static final String UNKNOWN = "Unknown";

    public static final List<InterpretationRule> RULES = List.of(
        new InterpretationRule("Fe³⁺ high-spin (tetrahedral)",
            ParameterWindow.of(0.15, 0.30), ParameterWindow.of(0.00, 1.00),
            "Consistent with ferric iron in tetrahedral coordination, as in ferrite spinels or Fe-substituted framework silicates."),
        new InterpretationRule("Fe³⁺ high-spin (octahedral)",
            ParameterWindow.of(0.30, 0.55), ParameterWindow.of(0.00, 1.50),
            "Consistent with ferric iron in octahedral oxygen coordination, typical of oxides, oxyhydroxides and clay minerals."),
        new InterpretationRule("Fe²⁺ high-spin (tetrahedral)",
            ParameterWindow.of(0.85, 1.05), ParameterWindow.of(1.50, 3.00),
            "Consistent with ferrous iron in tetrahedral coordination, as found in some spinels and staurolite."),
        new InterpretationRule("Fe²⁺ high-spin (octahedral)",
            ParameterWindow.of(1.05, 1.50), ParameterWindow.of(1.50, 3.50),
            "Consistent with ferrous iron in octahedral coordination, characteristic of olivines, pyroxenes and siderite."),
        new InterpretationRule("Low-spin Fe²⁺/Fe³⁺",
            ParameterWindow.of(-0.20, 0.15), ParameterWindow.of(0.00, 2.00),
            "The low isomer shift suggests low-spin iron, typical of cyanide or other strong-field coordination complexes."),
        new InterpretationRule("Fe³⁺",
            ParameterWindow.of(-0.20, 0.60), ParameterWindow.ANY,
            "The isomer shift indicates ferric iron; the splitting does not match a common coordination geometry."),
        new InterpretationRule("Fe²⁺",
            ParameterWindow.of(0.60, 1.50), ParameterWindow.ANY,
            "The isomer shift indicates ferrous iron; the splitting does not match a common coordination geometry.")
    );

    private SiteClassifier() {}

    /** First matching rule, or empty when none applies. */
    public static Optional<InterpretationRule> match(double isomerShift, double quadrupoleSplitting) {
        for (InterpretationRule rule : RULES) {
            if (rule.matches(isomerShift, quadrupoleSplitting)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public static Optional<InterpretationRule> match(Site site) {
        return match(site.isomerShift(), site.quadrupoleSplitting());
    }

    /** Label of the first matching rule, or {@value #UNKNOWN}. */
    public static String classify(double isomerShift, double quadrupoleSplitting) {
        return match(isomerShift, quadrupoleSplitting).map(InterpretationRule::label).orElse(UNKNOWN);
    }
}
