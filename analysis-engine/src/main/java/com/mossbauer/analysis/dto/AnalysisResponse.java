package com.mossbauer.analysis.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mossbauer.common.interpretation.Interpretation;
import com.mossbauer.common.interpretation.InterpretationPath;
import com.mossbauer.common.model.FitCurves;
import com.mossbauer.common.model.FitResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisResponse(
    @JsonProperty("success")        boolean success,
    @JsonProperty("traceId")        String traceId,
    @JsonProperty("fitResults")     FitResult fitResults,
    @JsonProperty("curves")         FitCurves curves,
    @JsonProperty("summary")        String summary,
    @JsonProperty("summarySource")  InterpretationPath summarySource,
    @JsonProperty("fallbackReason") String fallbackReason
) {
    public static AnalysisResponse of(String traceId, FitResult result, Interpretation interpretation) {
        return new AnalysisResponse(true, traceId, result.withoutCurves(), result.curves(),
            interpretation.text(), interpretation.path(), interpretation.fallbackReason());
    }
}
