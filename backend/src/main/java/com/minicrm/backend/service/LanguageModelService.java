package com.minicrm.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Client for an OpenAI-compatible chat completions endpoint.
 * <p>
 * Every failure surfaces as {@link BridgeUnavailableException}; callers decide how to
 * degrade. There are no retries.
 */
@Service
public class LanguageModelService {

    private static final Logger log = LoggerFactory.getLogger(LanguageModelService.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Value("${llm.api.url}")
    private String apiUrl;

    @Value("${llm.api.key:}")
    private String apiKey;

    @Value("${llm.api.model}")
    private String model;

    @Value("${llm.api.timeout-seconds:15}")
    private long timeoutSeconds;

    public LanguageModelService(ObjectMapper objectMapper) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        this.objectMapper = objectMapper;
    }

    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    public Duration defaultTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    /**
     * Send a chat completion request and return the assistant message text.
     *
     * @param timeout upper bound for the whole request
     */
    public String chatCompletion(List<Map<String, String>> messages, int maxTokens, double temperature,
            Duration timeout) {
        if (!isAvailable()) {
            throw new BridgeUnavailableException("Language model API key is not configured");
        }

        HttpResponse<String> response;
        try {
            String jsonBody = objectMapper.writeValueAsString(Map.of(
                    "model", model,
                    "max_tokens", maxTokens,
                    "temperature", temperature,
                    "messages", messages));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();

            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new BridgeUnavailableException("Language model timed out after " + timeout.toMillis() + " ms", e);
        } catch (IOException e) {
            throw new BridgeUnavailableException("Language model request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeUnavailableException("Language model request interrupted", e);
        }

        if (response.statusCode() != 200) {
            log.error("Language model API error: {} - {}", response.statusCode(), response.body());
            throw new BridgeUnavailableException("Language model API error: " + response.statusCode());
        }

        try {
            JsonNode content = objectMapper.readTree(response.body())
                    .path("choices")
                    .path(0)
                    .path("message")
                    .path("content");
            if (content.isMissingNode() || content.isNull()) {
                throw new BridgeUnavailableException("Language model response has no message content");
            }
            return content.asText();
        } catch (JsonProcessingException e) {
            throw new BridgeUnavailableException("Language model response is not JSON", e);
        }
    }

    /**
     * Send a chat completion request whose answer is expected to be a JSON object, possibly
     * wrapped in markdown fences or prose, and parse the first object found.
     */
    public JsonNode completeJson(List<Map<String, String>> messages, int maxTokens, double temperature,
            Duration timeout) {
        String content = chatCompletion(messages, maxTokens, temperature, timeout);
        String json = extractJsonObject(content);
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new BridgeUnavailableException("Language model returned malformed JSON", e);
        }
    }

    /**
     * First balanced {@code {...}} block of {@code text}, ignoring braces inside strings.
     */
    static String extractJsonObject(String text) {
        if (text == null) {
            throw new BridgeUnavailableException("Language model returned no content");
        }
        String cleaned = text.replace("```json", "").replace("```", "");
        int start = cleaned.indexOf('{');
        if (start < 0) {
            throw new BridgeUnavailableException("Language model response contains no JSON object");
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < cleaned.length(); i++) {
            char c = cleaned.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return cleaned.substring(start, i + 1);
                }
            }
        }
        throw new BridgeUnavailableException("Language model response contains an unterminated JSON object");
    }
}
