package com.mossbauer.analysis.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mossbauer.analysis.dto.AnalysisResponse;
import com.mossbauer.analysis.service.SpectrumAnalysisService;
import com.mossbauer.common.exception.DataFormatException;
import com.mossbauer.common.interpretation.Interpretation;
import com.mossbauer.common.lineshape.LineShape;
import com.mossbauer.common.model.FitOptions;
import com.mossbauer.common.model.FitResult;
import com.mossbauer.common.model.ParameterOverride;
import com.mossbauer.common.trace.TraceContextUtil;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.http.codec.multipart.FormFieldPart;
import org.springframework.http.codec.multipart.Part;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/spectra")
public class SpectrumController {

    public static final String API_KEY_HEADER = "X-Anthropic-Api-Key";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private static final TypeReference<Map<String, ParameterOverride>> OVERRIDES_TYPE = new TypeReference<>() {};

    private final SpectrumAnalysisService analysisService;
    private final ObjectMapper objectMapper;

    public SpectrumController(SpectrumAnalysisService analysisService, ObjectMapper objectMapper) {
        this.analysisService = analysisService;
        this.objectMapper = objectMapper;
    }

    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<AnalysisResponse>> analyze(
            @RequestBody Mono<MultiValueMap<String, Part>> parts,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
            @RequestHeader(value = TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        return parts.flatMap(form -> {
                FitOptions options = parseOptions(form);
                if (!(form.getFirst("file") instanceof FilePart file)) {
                    return Mono.error(new DataFormatException("No file uploaded. Send the spectrum as multipart part 'file'"));
                }
                return readBytes(file)
                    .flatMap(bytes -> analysisService.analyze(file.filename(), bytes, options, apiKey, traceId));
            })
            .map(ResponseEntity::ok);
    }

    @PostMapping(value = "/interpret", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Interpretation>> interpret(
            @RequestBody FitResult fitResult,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
            @RequestHeader(value = TRACE_ID_HEADER, required = false) String traceHeader) {
        return analysisService.interpret(fitResult, apiKey, TraceContextUtil.resolve(traceHeader))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    FitOptions parseOptions(MultiValueMap<String, Part> form) {
        String modelType = field(form, "modelType");
        String nSites = field(form, "nSites");
        String baselineCorrection = field(form, "baselineCorrection");
        String customParams = field(form, "customParams");

        LineShape lineShape = LineShape.fromWireName(modelType);
        Integer siteCount = nSites == null || "auto".equalsIgnoreCase(nSites) ? null : Integer.valueOf(nSites.trim());
        Boolean correction = baselineCorrection == null ? null : Boolean.valueOf(baselineCorrection.trim());
        return new FitOptions(lineShape, siteCount, parseOverrides(customParams), correction);
    }

    private Map<String, ParameterOverride> parseOverrides(String json) {
        if (json == null) return Map.of();
        try {
            Map<String, ParameterOverride> overrides = objectMapper.readValue(json, OVERRIDES_TYPE);
            return overrides == null ? Map.of() : overrides;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("customParams is not a valid JSON object of parameter overrides", e);
        }
    }

    private static String field(MultiValueMap<String, Part> form, String name) {
        Part part = form.getFirst(name);
        if (part instanceof FormFieldPart fieldPart) {
            String value = fieldPart.value();
            return value == null || value.isBlank() ? null : value;
        }
        return null;
    }

    private static Mono<byte[]> readBytes(FilePart file) {
        return DataBufferUtils.join(file.content())
            .map(buffer -> {
                byte[] bytes = new byte[buffer.readableByteCount()];
                buffer.read(bytes);
                DataBufferUtils.release(buffer);
                return bytes;
            })
            .defaultIfEmpty(new byte[0]);
    }
}
