package com.mossbauer.analysis.ai;

import com.mossbauer.common.interpretation.TextCompletionClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * {@link TextCompletionClient} over the Anthropic Messages API.
 *
 * <p>Non-blocking: the request is composed as a {@code Mono} chain and errors surface
 * as error signals. Timeout and fallback are the caller's concern.
 */
public class AnthropicCompletionClient implements TextCompletionClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicCompletionClient.class);

    static final String MESSAGES_PATH = "/v1/messages";
    static final String API_VERSION = "2023-06-01";

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final String model;

    public AnthropicCompletionClient(WebClient.Builder builder, ObjectMapper objectMapper,
                                     String baseUrl, String model) {
        this.anthropicClient = builder
            .baseUrl(baseUrl)
            .defaultHeader("anthropic-version", API_VERSION)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.objectMapper = objectMapper;
        this.model = model;
    }

    @Override
    public Mono<String> complete(String apiKey, String prompt, int maxOutputTokens, double temperature) {
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", maxOutputTokens,
            "temperature", temperature,
            "messages", List.of(Map.of("role", "user", "content", prompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .doOnNext(body -> log.debug("[AnthropicClient] Sending completion request. model={} maxTokens={}",
                model, maxOutputTokens))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri(MESSAGES_PATH)
                    .header("x-api-key", apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class))
            .map(this::extractText);
    }

    String extractText(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to parse Anthropic response", e);
        }
        JsonNode content = root.path("content");
        if (!content.isArray() || content.isEmpty()) {
            throw new IllegalStateException("Anthropic response has no content blocks");
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText("text"))) {
                text.append(block.path("text").asText(""));
            }
        }
        return text.toString();
    }
}
