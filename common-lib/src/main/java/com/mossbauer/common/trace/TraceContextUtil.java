package com.mossbauer.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries a per-analysis trace identifier through Reactor pipelines.
 *
 * <p>The Reactor Context holds the traceId. MDC is populated only for the duration
 * of a single log call via {@link #withMdc}, because reactive operators hop threads.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(analysis, traceId);
 *     ...
 *     .doOnEach(signal -> TraceContextUtil.withMdc(
 *         TraceContextUtil.getTraceId(signal.getContextView()), () -> log.info(...)))
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /** Short random identifier for a new analysis request. */
    public static String newTraceId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /** {@code candidate} when it is usable as a trace identifier, otherwise a fresh one. */
    public static String resolve(String candidate) {
        if (candidate == null || candidate.isBlank() || candidate.length() > 64) {
            return newTraceId();
        }
        return candidate.trim();
    }

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /** Emits the traceId of the subscribing pipeline. */
    static Mono<String> currentTraceId() {
        return Mono.deferContextual(ctx -> Mono.just(getTraceId(ctx)));
    }

    /** Runs {@code logAction} with the traceId in MDC, then removes it. */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
