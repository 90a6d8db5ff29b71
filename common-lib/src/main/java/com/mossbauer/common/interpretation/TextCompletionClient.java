package com.mossbauer.common.interpretation;

import reactor.core.publisher.Mono;

/**
 * Seam to an external text-completion service.
 *
 * <p>Implementations must be non-blocking and should signal failures through the
 * returned {@code Mono} rather than by throwing. The interpreter treats an empty or
 * errored {@code Mono} as a failed AI attempt.
 */
public interface TextCompletionClient {

    Mono<String> complete(String apiKey, String prompt, int maxOutputTokens, double temperature);
}
