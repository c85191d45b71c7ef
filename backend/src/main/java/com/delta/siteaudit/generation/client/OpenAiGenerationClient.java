package com.delta.siteaudit.generation.client;

import com.delta.siteaudit.config.AuditProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Chat-completions client for any OpenAI-compatible endpoint. Transport failures (I/O,
 * timeouts, 429 and 5xx) are retried a bounded number of times with jittered exponential
 * backoff; anything else fails the call immediately.
 */
@Service
public class OpenAiGenerationClient implements GenerationClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiGenerationClient.class);

    private final AuditProperties.Generation properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public OpenAiGenerationClient(AuditProperties properties, ObjectMapper objectMapper) {
        this.properties = properties.getGeneration();
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(Math.min(30, this.properties.getRequestTimeoutSeconds())))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    @Override
    public GenerationResponse complete(GenerationRequest request) {
        if (!properties.isConfigured()) {
            throw new GenerationCallException("Generation endpoint is not configured", 0);
        }
        String body = buildBody(request);
        int maxAttempts = 1 + properties.getTransportRetries();
        GenerationCallException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return send(body);
            } catch (RetryableCallException e) {
                last = e.toCallException();
                log.warn("Generation call attempt {}/{} failed: {}", attempt, maxAttempts, e.getMessage());
                if (attempt >= maxAttempts || !sleepBackoff(attempt)) {
                    break;
                }
            }
        }
        throw last;
    }

    private GenerationResponse send(String body) {
        HttpRequest httpRequest = HttpRequest.newBuilder(endpoint())
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("Authorization", "Bearer " + properties.getApiKey())
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();
        HttpResponse<String> response;
        try {
            response = client.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new RetryableCallException("timeout", 0, e);
        } catch (IOException e) {
            throw new RetryableCallException("io_error: " + e.getMessage(), 0, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationCallException("Generation call interrupted", e);
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new RetryableCallException("http_" + status, status, null);
        }
        if (status < 200 || status >= 300) {
            throw new GenerationCallException("Generation endpoint returned HTTP " + status, status);
        }
        return parseResponse(response.body());
    }

    private GenerationResponse parseResponse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new GenerationCallException("Generation endpoint returned invalid JSON", e);
        }
        JsonNode choice = root.path("choices").path(0);
        JsonNode content = choice.path("message").path("content");
        if (!content.isTextual()) {
            throw new GenerationCallException("Generation response has no message content", 200);
        }
        String finishReason = choice.path("finish_reason").isTextual() ? choice.path("finish_reason").asText() : null;
        String model = root.path("model").isTextual() ? root.path("model").asText() : properties.getModel();
        return new GenerationResponse(content.asText(), finishReason, model);
    }

    private String buildBody(GenerationRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", properties.getModel());
        body.put("temperature", properties.getTemperature());
        body.put("max_tokens", properties.getMaxTokens());
        body.putObject("response_format").put("type", "json_object");
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", request.systemPrompt());
        messages.addObject().put("role", "user").put("content", request.userPrompt());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize generation request", e);
        }
    }

    private URI endpoint() {
        String base = properties.getBaseUrl().trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/chat/completions");
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        long delay = Math.min(30_000L, (long) baseDelayMs * (1L << Math.max(0, attempt - 1)));
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        try {
            Thread.sleep((delay / 2) + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static final class RetryableCallException extends RuntimeException {
        private final int statusCode;

        private RetryableCallException(String message, int statusCode, Throwable cause) {
            super(message, cause);
            this.statusCode = statusCode;
        }

        private GenerationCallException toCallException() {
            return getCause() == null
                ? new GenerationCallException("Generation call failed: " + getMessage(), statusCode)
                : new GenerationCallException("Generation call failed: " + getMessage(), getCause());
        }
    }
}
