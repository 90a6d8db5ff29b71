package com.mossbauer.analysis.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mossbauer.analysis.logger.AnalysisFlowLogger;
import com.mossbauer.analysis.service.SpectrumAnalysisService;
import com.mossbauer.common.fitting.SpectrumFitter;
import com.mossbauer.common.interpretation.InterpreterContext;
import com.mossbauer.common.interpretation.SpectrumInterpreter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;

class SpectrumControllerTest {

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        SpectrumAnalysisService service = new SpectrumAnalysisService(
            new SpectrumFitter(), new SpectrumInterpreter(InterpreterContext.offline()), new AnalysisFlowLogger());
        client = WebTestClient.bindToController(new SpectrumController(service, new ObjectMapper()))
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    /** Lorentzian doublets at ±1.2 mm/s (depth 0.20) and ±2.5 mm/s (depth 0.10), 200 points. */
    private static String twoSiteCsv() {
        StringBuilder sb = new StringBuilder();
        double sigma = 0.15;
        double[][] lines = {{-1.2, 0.20}, {1.2, 0.20}, {-2.5, 0.10}, {2.5, 0.10}};
        for (int i = 0; i < 200; i++) {
            double v = -4.0 + 8.0 * i / 199;
            double a = 1.0;
            for (double[] line : lines) {
                double dx = v - line[0];
                a -= line[1] * sigma * sigma / (dx * dx + sigma * sigma);
            }
            sb.append(v).append(',').append(a).append('\n');
        }
        return sb.toString();
    }

    private WebTestClient.ResponseSpec analyze(String fileName, String content, Map<String, String> fields) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        if (fileName != null) {
            builder.part("file", content.getBytes(StandardCharsets.UTF_8)).filename(fileName);
        }
        fields.forEach(builder::part);
        return client.post().uri("/api/v1/spectra/analyze")
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(BodyInserters.fromMultipartData(builder.build()))
            .exchange();
    }

    // ── /analyze ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("POST /analyze")
    class AnalyzeTests {

        @Test
        @DisplayName("valid spectrum → fit results, curves and rule-based summary")
        void analyzeSuccess() {
            analyze("two-site.csv", twoSiteCsv(), Map.of("modelType", "lorentzian"))
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.traceId").exists()
                .jsonPath("$.fitResults.sites.length()").isEqualTo(2)
                .jsonPath("$.fitResults.model_type").isEqualTo("lorentzian")
                .jsonPath("$.fitResults.curves").doesNotExist()
                .jsonPath("$.curves.velocity.length()").isEqualTo(200)
                .jsonPath("$.summarySource").isEqualTo("RULE_BASED")
                .jsonPath("$.summary").value(containsString("Site 2"));
        }

        @Test
        @DisplayName("explicit site count and trace header are honoured")
        void explicitSiteCount() {
            MultipartBodyBuilder builder = new MultipartBodyBuilder();
            builder.part("file", twoSiteCsv().getBytes(StandardCharsets.UTF_8)).filename("s.txt");
            builder.part("nSites", "1");
            client.post().uri("/api/v1/spectra/analyze")
                .header(SpectrumController.TRACE_ID_HEADER, "trace-77")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.traceId").isEqualTo("trace-77")
                .jsonPath("$.fitResults.sites.length()").isEqualTo(1)
                .jsonPath("$.fitResults.sites[0].relative_area").isEqualTo(100.0);
        }

        @Test
        @DisplayName("unsupported extension → 400 DATA_FORMAT")
        void unsupportedExtension() {
            analyze("spectrum.json", twoSiteCsv(), Map.of())
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo("DATA_FORMAT")
                .jsonPath("$.stage").isEqualTo("Ingestion");
        }

        @Test
        @DisplayName("fewer than 10 rows → 400 DATA_FORMAT")
        void tooFewRows() {
            analyze("short.csv", "0,1\n1,0.9\n2,1\n", Map.of())
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Insufficient data points (minimum 10 required)");
        }

        @Test
        @DisplayName("non-numeric data → 400 DATA_TYPE")
        void nonNumeric() {
            analyze("header.csv", "velocity,transmission\n" + twoSiteCsv(), Map.of())
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo("DATA_TYPE");
        }

        @Test
        @DisplayName("missing file part → 400")
        void missingFile() {
            analyze(null, "", Map.of("modelType", "voigt"))
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo("DATA_FORMAT");
        }

        @Test
        @DisplayName("invalid options → 400 INVALID_OPTIONS")
        void invalidOptions() {
            analyze("a.csv", twoSiteCsv(), Map.of("nSites", "9"))
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.errorCode").isEqualTo("INVALID_OPTIONS");
            analyze("a.csv", twoSiteCsv(), Map.of("modelType", "gaussian"))
                .expectStatus().isBadRequest();
            analyze("a.csv", twoSiteCsv(), Map.of("customParams", "{not json"))
                .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("override with min above max → 400 INVALID_OPTIONS")
        void invertedBounds() {
            analyze("a.csv", twoSiteCsv(), Map.of("nSites", "2",
                    "customParams", "{\"peak1_center\": {\"min\": 2.0, \"max\": -2.0}}"))
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo("INVALID_OPTIONS")
                .jsonPath("$.message").value(containsString("peak1_center"));
        }

        @Test
        @DisplayName("every parameter fixed → 422 FIT_CONVERGENCE")
        void nothingToFit() {
            String overrides = """
                {"peak1_amplitude": {"value": 0.1, "vary": false},
                 "peak1_center":    {"value": -1.2, "vary": false},
                 "peak1_sigma":     {"value": 0.15, "vary": false},
                 "peak2_amplitude": {"value": 0.1, "vary": false},
                 "peak2_center":    {"value": 1.2, "vary": false},
                 "peak2_sigma":     {"value": 0.15, "vary": false},
                 "baseline":        {"value": 1.0, "vary": false}}
                """;
            analyze("a.csv", twoSiteCsv(), Map.of("nSites", "1", "customParams", overrides))
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo("FIT_CONVERGENCE")
                .jsonPath("$.stage").isEqualTo("Optimizer");
        }
    }

    // ── /interpret and /health ────────────────────────────────────────────

    @Test
    @DisplayName("POST /interpret → rule-based summary for a posted fit result")
    void interpret() {
        String body = """
            {"sites": [{"isomer_shift": 0.35, "quadrupole_splitting": 0.7, "line_width": 0.3,
                        "relative_area": 100.0, "site_type": "Fe³⁺ high-spin (octahedral)"}],
             "chi_squared": 120.0, "reduced_chi_squared": 1.2, "n_data_points": 107,
             "n_variables": 7, "model_type": "lorentzian", "unexpected": true}
            """;
        client.post().uri("/api/v1/spectra/interpret")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.summarySource").isEqualTo("RULE_BASED")
            .jsonPath("$.fallbackReason").isEqualTo("no credential configured")
            .jsonPath("$.summary").value(containsString("excellent"));
    }

    @Test
    @DisplayName("GET /health → OK")
    void health() {
        client.get().uri("/api/v1/spectra/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
