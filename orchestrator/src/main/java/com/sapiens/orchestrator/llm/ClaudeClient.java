package com.sapiens.orchestrator.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * One call = one single-turn conversation: the agent's system instructions go
 * in "system", the serialized agent input is the only user message. Agents
 * are stateless, so no history is ever sent.
 *
 * Raw HttpClient keeps every header and byte on the wire visible.
 */
@Component
public class ClaudeClient implements TextGenerationBackend {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** role must be "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Extracts the text from the first text block. */
        public String firstText() {
            if (content == null) {
                throw new IllegalStateException("No content in response");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_URL = "https://api.anthropic.com/v1/messages";
    private static final String API_VER = "2023-06-01";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       model;
    private final Duration     requestTimeout;

    public ClaudeClient(@Value("${anthropic.api-key}") String apiKey,
                        @Value("${sapiens.llm.model}") String model,
                        @Value("${sapiens.llm.request-timeout:60s}") Duration requestTimeout,
                        ObjectMapper objectMapper) {
        this.apiKey         = apiKey;
        this.model          = model;
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    @Override
    public String generate(String systemInstructions, String userPayload, GenerationConstraints constraints) {
        try {
            // { model, max_tokens, temperature, system, messages: [{role, content}] }
            String requestBody = json.writeValueAsString(Map.of(
                    "model",       model,
                    "max_tokens",  constraints.maxTokens(),
                    "temperature", constraints.temperature(),
                    "system",      systemInstructions,
                    "messages",    List.of(new Message("user", userPayload))
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(API_URL))
                    .timeout(requestTimeout)
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                log.warn("Messages API returned HTTP {}", response.statusCode());
                throw new BackendException(response.statusCode(), response.body());
            }

            MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
            return parsed.firstText();

        } catch (BackendException e) {
            throw e;
        } catch (InterruptedException e) {
            // The invoker cancels timed-out calls by interrupting the worker.
            Thread.currentThread().interrupt();
            throw new BackendException("Messages API call interrupted", e);
        } catch (Exception e) {
            throw new BackendException("Messages API call failed", e);
        }
    }
}
