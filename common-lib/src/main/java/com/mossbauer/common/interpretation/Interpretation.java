package com.mossbauer.common.interpretation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Typed outcome of interpretation: either text from the completion service, or the
 * rule-based summary together with the reason the AI path was not used.
 *
 * @param fallbackReason null when {@code path == AI_ATTEMPT}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Interpretation(
    @JsonProperty("summary")         String text,
    @JsonProperty("summarySource")   InterpretationPath path,
    @JsonProperty("fallbackReason")  String fallbackReason
) {
    public static Interpretation ai(String text) {
        return new Interpretation(text, InterpretationPath.AI_ATTEMPT, null);
    }

    public static Interpretation ruleBased(String text, String fallbackReason) {
        return new Interpretation(text, InterpretationPath.RULE_BASED, fallbackReason);
    }
}
