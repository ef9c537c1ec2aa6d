package com.stresscast.scenario.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.stresscast.scenario.config.StresscastProperties;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Thin client for the OpenAI Responses API. Every failure degrades to {@link Optional#empty()}
 * so callers can fall back to deterministic text.
 */
@Component
public class TextGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(TextGenerationClient.class);
    private static final int DEFAULT_MAX_TOKENS = 1000;
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final StresscastProperties.Ai settings;
    private final RestClient restClient;

    public record Message(String role, String content) {}

    public record ResponsesRequest(String model, List<Message> input, Integer max_output_tokens) {}

    public TextGenerationClient(StresscastProperties properties) {
        this.settings = properties.ai();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(CONNECT_TIMEOUT);
        requestFactory.setReadTimeout(Duration.ofMillis(settings.timeoutMs()));

        this.restClient = RestClient.builder().requestFactory(requestFactory).build();
        log.info("Text generation client configured: endpoint={}, model={}, readTimeoutMs={}, credentials={}",
                settings.endpoint(), settings.model(), settings.timeoutMs(), settings.hasApiKey());
    }

    public boolean hasCredentials() {
        return settings.hasApiKey();
    }

    public Optional<String> generateText(List<Message> inputMessages, Integer maxOutputTokens) {
        if (!settings.hasApiKey()) {
            return Optional.empty();
        }
        int maxTokens = maxOutputTokens != null && maxOutputTokens > 0 ? maxOutputTokens : DEFAULT_MAX_TOKENS;
        ResponsesRequest requestBody = new ResponsesRequest(settings.model(), inputMessages, maxTokens);
        try {
            JsonNode response = restClient.post()
                    .uri(settings.endpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> headers.setBearerAuth(settings.apiKey()))
                    .body(requestBody)
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null) {
                return Optional.empty();
            }
            String text = extractText(response.get("output"));
            if (text == null || text.isBlank()) {
                text = extractText(response.get("output_text"));
            }
            return Optional.ofNullable(text).filter(s -> !s.isBlank());
        } catch (RestClientResponseException ex) {
            log.warn("Text generation call failed (status {}): {}", ex.getStatusCode(), ex.getMessage());
        } catch (Exception ex) {
            log.warn("Text generation call failed: {}", ex.getMessage());
        }
        return Optional.empty();
    }

    static String extractText(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                String nested = extractText(item);
                if (nested != null && !nested.isBlank()) {
                    return nested;
                }
            }
            return null;
        }
        for (String field : List.of("content", "text")) {
            String nested = extractText(node.get(field));
            if (nested != null && !nested.isBlank()) {
                return nested;
            }
        }
        return null;
    }
}
