package com.mossbauer.analysis.service;

import com.mossbauer.analysis.dto.AnalysisResponse;
import com.mossbauer.analysis.logger.AnalysisFlowLogger;
import com.mossbauer.common.fitting.SpectrumFitter;
import com.mossbauer.common.ingestion.SpectrumReader;
import com.mossbauer.common.interpretation.Interpretation;
import com.mossbauer.common.interpretation.SpectrumInterpreter;
import com.mossbauer.common.model.FitOptions;
import com.mossbauer.common.model.FitResult;
import com.mossbauer.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs ingestion, fitting and interpretation for one uploaded spectrum.
 *
 * <p>Parsing and optimization are CPU-bound and blocking, so they run on the
 * bounded-elastic scheduler. Interpretation is non-blocking and never fails; errors
 * from the earlier stages propagate to the caller unchanged.
 */
@Service
public class SpectrumAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(SpectrumAnalysisService.class);

    private final SpectrumFitter fitter;
    private final SpectrumInterpreter interpreter;
    private final AnalysisFlowLogger flowLogger;

    public SpectrumAnalysisService(SpectrumFitter fitter, SpectrumInterpreter interpreter,
                                   AnalysisFlowLogger flowLogger) {
        this.fitter = fitter;
        this.interpreter = interpreter;
        this.flowLogger = flowLogger;
    }

    public Mono<AnalysisResponse> analyze(String fileName, byte[] content, FitOptions options,
                                          String apiKey, String traceId) {
        FitOptions effective = options == null ? FitOptions.defaults() : options;
        log.info("[AnalysisService] Analysis requested. file={} bytes={} lineShape={} sites={} traceId={}",
            fileName, content.length, effective.lineShape().wireName(),
            effective.siteCount() == null ? "auto" : effective.siteCount(), traceId);

        Mono<AnalysisResponse> pipeline = Mono.fromCallable(
                () -> SpectrumReader.read(fileName, content, effective.baselineCorrection()))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnEach(flowLogger.stage(AnalysisFlowLogger.SPECTRUM_LOADED))
            .map(spectrum -> fitter.fit(spectrum, effective))
            .doOnEach(flowLogger.stage(AnalysisFlowLogger.FIT_COMPLETED))
            .flatMap(result -> interpreter.withCredential(apiKey).interpret(result)
                .doOnEach(flowLogger.stage(AnalysisFlowLogger.INTERPRETATION_RESOLVED))
                .map(interpretation -> AnalysisResponse.of(traceId, result, interpretation)))
            .doOnEach(flowLogger.failure());

        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    public Mono<Interpretation> interpret(FitResult result, String apiKey, String traceId) {
        log.info("[AnalysisService] Interpretation requested. sites={} traceId={}", result.siteCount(), traceId);
        Mono<Interpretation> pipeline = interpreter.withCredential(apiKey).interpret(result)
            .doOnEach(flowLogger.stage(AnalysisFlowLogger.INTERPRETATION_RESOLVED));
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }
}
