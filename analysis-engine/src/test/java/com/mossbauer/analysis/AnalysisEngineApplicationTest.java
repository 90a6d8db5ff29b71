package com.mossbauer.analysis;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.reactive.server.WebTestClient;

@SpringBootTest(properties = "anthropic.api-key=")
@AutoConfigureWebTestClient
class AnalysisEngineApplicationTest {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    void contextLoadsAndServesHealth() {
        webTestClient.get().uri("/api/v1/spectra/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
