package com.openforge.memorylane.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Raw HttpClient + Jackson client for a local Ollama embedding endpoint.
 *
 * Only the real path lives here; falling back to mock vectors is the
 * responsibility of {@link EmbeddingService}. Vectors are returned verbatim,
 * a dimension other than the configured one is an error.
 */
@Slf4j
@Component
public class EmbeddingClient {

    private static final int MAX_INPUT_CHARS = 8000;

    private final HttpClient          httpClient;
    private final ObjectMapper        objectMapper;
    private final EmbeddingProperties props;

    public EmbeddingClient(HttpClient httpClient,
                           ObjectMapper objectMapper,
                           EmbeddingProperties props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    /**
     * Embeds every input in a single request.
     *
     * @return one vector per input, in input order
     */
    public List<float[]> embedAll(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        List<String> input = new ArrayList<>(texts.size());
        for (String text : texts) {
            if (text == null || text.isBlank()) {
                throw new IllegalArgumentException("Cannot embed blank text");
            }
            // Trim to a safe length to avoid exceeding model token limits
            input.add(text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text);
        }

        String body = serialize(EmbeddingRequest.of(props.model(), input));
        log.debug("[Embed] → POST /api/embed model={} inputs={}", props.model(), input.size());

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(props.baseUrl() + "/api/embed"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        return parseEmbeddings(send(httpRequest), input.size());
    }

    /** True when GET /api/tags answers and lists the configured model. Never throws. */
    public boolean isModelAvailable() {
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(props.baseUrl() + "/api/tags"))
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .GET()
                .build();
        try {
            HttpResponse<String> response = send(httpRequest);
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.debug("[Embed] Health check returned HTTP {}", response.statusCode());
                return false;
            }
            ModelTagsResponse tags = objectMapper.readValue(response.body(), ModelTagsResponse.class);
            boolean available = tags != null && tags.contains(props.model());
            if (!available) {
                log.debug("[Embed] Model {} is not installed at {}", props.model(), props.baseUrl());
            }
            return available;
        } catch (EmbeddingException | JsonProcessingException e) {
            log.debug("[Embed] Health check failed: {}", e.getMessage());
            return false;
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EmbeddingUnavailableException("Network error calling embedding endpoint: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException("Interrupted while calling embedding endpoint", e);
        }
    }

    private List<float[]> parseEmbeddings(HttpResponse<String> response, int expected) {
        int    status = response.statusCode();
        String body   = response.body();

        if (status < 200 || status >= 300) {
            throw new EmbeddingUnavailableException(
                    "Embedding endpoint returned HTTP %d: %s".formatted(status, body));
        }

        EmbeddingResponse resp;
        try {
            resp = objectMapper.readValue(body, EmbeddingResponse.class);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to parse embedding response: " + body, e);
        }
        if (resp == null || resp.count() != expected) {
            throw new EmbeddingException("Expected %d embeddings, got %d"
                    .formatted(expected, resp == null ? 0 : resp.count()));
        }

        List<float[]> vectors = new ArrayList<>(expected);
        for (List<Float> raw : resp.embeddings()) {
            if (raw == null || raw.size() != props.dimensions()) {
                throw new EmbeddingDimensionMismatchException(props.dimensions(), raw == null ? 0 : raw.size());
            }
            float[] vector = new float[raw.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = raw.get(i);
            }
            vectors.add(vector);
        }
        log.debug("[Embed] ← {} vector(s) dim={}", vectors.size(), props.dimensions());
        return vectors;
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to serialize embedding request", e);
        }
    }

    // ── Exceptions ───────────────────────────────────────────────────────────

    public static class EmbeddingException extends RuntimeException {
        public EmbeddingException(String message) { super(message); }
        public EmbeddingException(String message, Throwable cause) { super(message, cause); }
    }

    /** Endpoint down, unreachable or answering with an error status. */
    public static class EmbeddingUnavailableException extends EmbeddingException {
        public EmbeddingUnavailableException(String message) { super(message); }
        public EmbeddingUnavailableException(String message, Throwable cause) { super(message, cause); }
    }

    /** The model answered with a vector of the wrong size. Never masked by a mock fallback. */
    public static class EmbeddingDimensionMismatchException extends EmbeddingException {

        private final int expected;
        private final int actual;

        public EmbeddingDimensionMismatchException(int expected, int actual) {
            super("Embedding dimension mismatch: expected %d, got %d".formatted(expected, actual));
            this.expected = expected;
            this.actual   = actual;
        }

        public int expected() { return expected; }
        public int actual()   { return actual; }
    }
}
