package com.mossbauer.common.interpretation;

/** Which branch produced an {@link Interpretation}. */
public enum InterpretationPath {
    AI_ATTEMPT,
    RULE_BASED
}
