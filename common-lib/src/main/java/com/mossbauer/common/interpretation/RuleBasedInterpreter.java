package com.mossbauer.common.interpretation;

import com.mossbauer.common.classifier.InterpretationRule;
import com.mossbauer.common.classifier.SiteClassifier;
import com.mossbauer.common.model.FitResult;
import com.mossbauer.common.model.Site;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Deterministic templated summary of a {@link FitResult}.
 *
 * <p>One line per site with its parameters, classification and commentary, followed
 * by a fit-quality sentence. A pure function of its input.
 */
public final class RuleBasedInterpreter {

    static final String OUT_OF_RANGE = "The parameters fall outside the reference ranges for common iron environments.";

    private RuleBasedInterpreter() {}

    public static String summarize(FitResult result) {
        List<Site> sites = result.sites();
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "The %s fit resolved %d site%s.\n",
            result.lineShape().wireName(), sites.size(), sites.size() == 1 ? "" : "s"));

        for (int i = 0; i < sites.size(); i++) {
            Site site = sites.get(i);
            Optional<InterpretationRule> rule = SiteClassifier.match(site);
            String label = rule.map(InterpretationRule::label).orElse(SiteClassifier.UNKNOWN);

            sb.append(String.format(Locale.ROOT,
                "Site %d (%.1f%% of absorption area): IS = %.3f mm/s, QS = %.3f mm/s, linewidth = %.3f mm/s. Assigned to %s. %s",
                i + 1, site.relativeArea(), site.isomerShift(), site.quadrupoleSplitting(), site.lineWidth(),
                label, rule.map(InterpretationRule::commentary).orElse(OUT_OF_RANGE)));
            sb.append('\n');
        }

        FitQuality quality = FitQuality.of(result.reducedChiSquared());
        sb.append(String.format(Locale.ROOT, "Fit quality is %s (reduced chi-squared = %.3f).",
            quality.label(), result.reducedChiSquared()));
        return sb.toString();
    }
}
