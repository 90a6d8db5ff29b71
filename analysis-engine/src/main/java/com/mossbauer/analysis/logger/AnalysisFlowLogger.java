package com.mossbauer.analysis.logger;

import com.mossbauer.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs the stages of one spectrum analysis as it moves through the reactive pipeline.
 * Pure side effects; never alters the pipeline.
 *
 * <ol>
 *   <li>{@link #SPECTRUM_LOADED}         — file parsed and normalized</li>
 *   <li>{@link #FIT_COMPLETED}           — optimizer converged, sites extracted</li>
 *   <li>{@link #INTERPRETATION_RESOLVED} — summary produced by the AI or rule-based path</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(AnalysisFlowLogger.FIT_COMPLETED))
 * </pre>
 */
@Component
public class AnalysisFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AnalysisFlowLogger.class);

    public static final String SPECTRUM_LOADED         = "SPECTRUM_LOADED";
    public static final String FIT_COMPLETED           = "FIT_COMPLETED";
    public static final String INTERPRETATION_RESOLVED = "INTERPRETATION_RESOLVED";

    /** {@code doOnEach} consumer logging {@code stageName} on each onNext, traceId from the Reactor Context. */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[AnalysisFlow] stage={} traceId={}", stageName, traceId));
        };
    }

    /** {@code doOnEach} consumer logging a failed analysis. */
    public <T> Consumer<Signal<T>> failure() {
        return signal -> {
            if (!signal.isOnError()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            Throwable error = signal.getThrowable();
            TraceContextUtil.withMdc(traceId, () ->
                log.warn("[AnalysisFlow] Analysis failed. traceId={} error={} reason={}",
                    traceId, error.getClass().getSimpleName(), error.getMessage()));
        };
    }
}
