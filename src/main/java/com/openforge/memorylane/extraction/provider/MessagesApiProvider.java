package com.openforge.memorylane.extraction.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memorylane.extraction.ExtractionException.ProviderFailureException;
import com.openforge.memorylane.extraction.ExtractionProperties;
import com.openforge.memorylane.extraction.ExtractionProvider;
import com.openforge.memorylane.extraction.ProviderKind;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

/**
 * Stateless client for the keyed messages API.
 *
 * Not a Spring bean: the API key belongs to the caller, so one instance is built
 * per extraction run around the shared HttpClient and ObjectMapper.
 */
@Slf4j
public class MessagesApiProvider implements ExtractionProvider {

    private static final String MESSAGES_PATH = "/v1/messages";

    private final HttpClient                     httpClient;
    private final ObjectMapper                   objectMapper;
    private final ExtractionProperties.ApiConfig config;
    private final String                         apiKey;

    public MessagesApiProvider(HttpClient httpClient,
                               ObjectMapper objectMapper,
                               ExtractionProperties.ApiConfig config,
                               String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey must not be blank");
        }
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
        this.apiKey       = apiKey;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.API;
    }

    @Override
    public String send(String systemPrompt, String userPrompt, Duration timeout) {
        MessagesRequest request = MessagesRequest.builder()
                .model(config.model())
                .maxTokens(config.maxTokens())
                .system(systemPrompt)
                .messages(List.of(MessagesRequest.Turn.user(userPrompt)))
                .build();

        String body = serialize(request);
        log.debug("[MessagesApi:{}] → POST body-length={}", config.model(), body.length());

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + MESSAGES_PATH))
                .header("Content-Type", "application/json")
                .header("x-api-key", apiKey)
                .header("anthropic-version", config.version())
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        return parse(sendBlocking(httpRequest));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpResponse<String> sendBlocking(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderFailureException("Messages API timed out", e);
        } catch (IOException e) {
            throw new ProviderFailureException("Network error calling messages API: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderFailureException("Interrupted while calling messages API", e);
        }
    }

    private String parse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[MessagesApi:{}] ← HTTP {} body-length={}", config.model(), status,
                body == null ? 0 : body.length());

        if (status < 200 || status >= 300) {
            throw new ProviderFailureException(
                    "Messages API returned HTTP %d: %s".formatted(status, snippet(body)));
        }

        MessagesResponse envelope;
        try {
            envelope = objectMapper.readValue(body, MessagesResponse.class);
        } catch (JsonProcessingException e) {
            throw new ProviderFailureException("Unparsable messages API envelope: " + snippet(body), e);
        }
        if (envelope == null) {
            throw new ProviderFailureException("Messages API returned an empty body");
        }
        return envelope.text();
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ProviderFailureException("Failed to serialize messages request", e);
        }
    }

    private static String snippet(String body) {
        if (body == null) return "";
        return body.length() > 512 ? body.substring(0, 512) + "…" : body;
    }
}
