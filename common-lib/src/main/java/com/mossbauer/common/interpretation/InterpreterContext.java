package com.mossbauer.common.interpretation;

import java.time.Duration;

/**
 * Everything the interpreter needs to reach the completion service.
 *
 * @param apiKey          credential; null or blank disables the AI path
 * @param client          completion client; may be null when no AI path is wired
 * @param maxOutputTokens response length cap
 * @param temperature     sampling temperature
 * @param timeout         upper bound on the whole AI attempt
 */
public record InterpreterContext(
    String apiKey,
    TextCompletionClient client,
    int maxOutputTokens,
    double temperature,
    Duration timeout
) {
    public static final int DEFAULT_MAX_OUTPUT_TOKENS = 300;
    public static final double DEFAULT_TEMPERATURE = 0.4;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(20);

    public InterpreterContext {
        if (timeout == null) timeout = DEFAULT_TIMEOUT;
    }

    /** Rule-based only. */
    public static InterpreterContext offline() {
        return new InterpreterContext(null, null, DEFAULT_MAX_OUTPUT_TOKENS, DEFAULT_TEMPERATURE, DEFAULT_TIMEOUT);
    }

    public boolean hasCredential() {
        return apiKey != null && !apiKey.isBlank();
    }

    public InterpreterContext withApiKey(String newApiKey) {
        return new InterpreterContext(newApiKey, client, maxOutputTokens, temperature, timeout);
    }

    @Override
    public String toString() {
        return "InterpreterContext[credential=" + (hasCredential() ? "***" : "none")
            + ", maxOutputTokens=" + maxOutputTokens + ", temperature=" + temperature
            + ", timeout=" + timeout + "]";
    }
}
