package com.prpilot.orchestrator.generator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Single-turn client for the Anthropic Messages API.
 *
 * Raw HttpClient rather than an SDK: the endpoint is plain JSON over HTTPS
 * and the request/response shapes we use are small.
 */
public class ClaudeClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** role is "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content,
                                   @JsonProperty("stop_reason") String stopReason) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** All text blocks joined; empty if the model returned none. */
        public String text() {
            if (content == null) return "";
            return content.stream()
                    .filter(b -> "text".equals(b.type()) && b.text() != null)
                    .map(ContentBlock::text)
                    .collect(Collectors.joining("\n"));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_VER = "2023-06-01";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiUrl;
    private final String       apiKey;
    private final int          maxTokens;
    private final Duration     timeout;

    public ClaudeClient(HttpClient http, ObjectMapper objectMapper, String apiUrl, String apiKey,
                        int maxTokens, Duration timeout) {
        this.http      = http;
        this.json      = objectMapper;
        this.apiUrl    = apiUrl;
        this.apiKey    = apiKey;
        this.maxTokens = maxTokens;
        this.timeout   = timeout;
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Sends one system prompt plus conversation and returns the reply text.
     *
     * @throws ClaudeApiException on a non-200 response
     */
    public String complete(String model, String system, List<Message> messages) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("max_tokens", maxTokens);
        if (system != null && !system.isBlank()) {
            payload.put("system", system);
        }
        payload.put("messages", messages);

        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(timeout)
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(payload)))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new ClaudeApiException(response.statusCode(), response.body());
            }

            MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
            if ("max_tokens".equals(parsed.stopReason())) {
                log.warn("Claude reply was cut off at {} tokens; trailing file blocks may be incomplete", maxTokens);
            }
            return parsed.text();

        } catch (IOException e) {
            throw new ClaudeApiException("Claude API call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClaudeApiException("Interrupted while waiting for Claude", e);
        }
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class ClaudeApiException extends RuntimeException {
        private final int statusCode;

        public ClaudeApiException(int statusCode, String body) {
            super("Claude API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
        }

        public ClaudeApiException(String message, Throwable cause) {
            super(message, cause);
            this.statusCode = -1;
        }

        public int statusCode() { return statusCode; }
    }
}
