package com.mossbauer.common.interpretation;

import com.mossbauer.common.model.FitResult;
import com.mossbauer.common.model.Site;

import java.util.List;
import java.util.Locale;

/** Builds the completion prompt from a fit result. */
public final class InterpretationPromptBuilder {

    private InterpretationPromptBuilder() {}

    public static String build(FitResult result) {
        StringBuilder siteTable = new StringBuilder();
        List<Site> sites = result.sites();
        for (int i = 0; i < sites.size(); i++) {
            Site s = sites.get(i);
            siteTable.append(String.format(Locale.ROOT,
                "  - Site %d: IS=%.3f mm/s  QS=%.3f mm/s  linewidth=%.3f mm/s  area=%.1f%%  rule-based type=%s%n",
                i + 1, s.isomerShift(), s.quadrupoleSplitting(), s.lineWidth(), s.relativeArea(), s.siteType()));
        }

        return """
            You are a Mössbauer spectroscopy expert. Based on the following parameters \
            from a 57Fe spectrum fit, provide a brief interpretation of the iron sites.

            Line shape:          %s
            Sites:
            %s
            Fit statistics:
              chi-square         : %.4f
              reduced chi-square : %.4f
              data points        : %d
              variables          : %d

            Explain what each site could represent in terms of oxidation state and spin state. \
            Write your answer as if for a research paper or thesis.
            """.formatted(result.lineShape().wireName(), siteTable,
                          result.chiSquared(), result.reducedChiSquared(),
                          result.nDataPoints(), result.nVariables());
    }
}
