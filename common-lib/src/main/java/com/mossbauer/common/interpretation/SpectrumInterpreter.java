package com.mossbauer.common.interpretation;

import com.mossbauer.common.model.FitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.concurrent.TimeoutException;

/**
 * Produces a natural-language summary of a {@link FitResult}.
 *
 * <h3>Decision</h3>
 * <ol>
 *   <li>No credential or no client → {@link InterpretationPath#RULE_BASED} immediately</li>
 *   <li>Otherwise one {@link InterpretationPath#AI_ATTEMPT}, bounded by the context timeout</li>
 *   <li>Any error, timeout or blank response → {@code RULE_BASED} with the reason recorded</li>
 * </ol>
 *
 * <p>The AI path is attempted at most once per call and never retried. The returned
 * {@code Mono} always emits exactly one {@link Interpretation} and never errors.
 */
public final class SpectrumInterpreter {

    private static final Logger log = LoggerFactory.getLogger(SpectrumInterpreter.class);

    static final String NO_CREDENTIAL = "no credential configured";
    static final String EMPTY_RESPONSE = "empty response from completion service";

    private final InterpreterContext context;

    public SpectrumInterpreter(InterpreterContext context) {
        this.context = context == null ? InterpreterContext.offline() : context;
    }

    InterpreterContext context() {
        return context;
    }

    /** A new interpreter using {@code apiKey} for its AI path; blank keeps the configured one. */
    public SpectrumInterpreter withCredential(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return this;
        }
        return new SpectrumInterpreter(context.withApiKey(apiKey));
    }

    public Mono<Interpretation> interpret(FitResult result) {
        if (!context.hasCredential() || context.client() == null) {
            log.info("[Interpreter] No completion credential configured. Using rule-based summary. sites={}",
                result.siteCount());
            return Mono.fromSupplier(() -> Interpretation.ruleBased(RuleBasedInterpreter.summarize(result), NO_CREDENTIAL));
        }

        return Mono.fromCallable(() -> InterpretationPromptBuilder.build(result))
            .flatMap(prompt -> context.client().complete(
                context.apiKey(), prompt, context.maxOutputTokens(), context.temperature()))
            .map(String::trim)
            .filter(text -> !text.isEmpty())
            .map(Interpretation::ai)
            .timeout(context.timeout())
            .doOnNext(i -> log.info("[Interpreter] AI summary generated. sites={} chars={}",
                result.siteCount(), i.text().length()))
            .switchIfEmpty(Mono.fromSupplier(() -> {
                log.warn("[Interpreter] Completion service returned no text. Falling back to rule-based summary.");
                return Interpretation.ruleBased(RuleBasedInterpreter.summarize(result), EMPTY_RESPONSE);
            }))
            .onErrorResume(e -> {
                String reason = describe(e);
                log.warn("[Interpreter] AI summary failed. Falling back to rule-based summary. reason={}", reason);
                return Mono.just(Interpretation.ruleBased(RuleBasedInterpreter.summarize(result), reason));
            });
    }

    private String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "completion timed out after " + context.timeout().toMillis() + "ms";
        }
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null || message.isBlank() ? "" : ": " + message);
    }
}
