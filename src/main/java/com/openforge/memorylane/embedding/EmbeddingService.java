package com.openforge.memorylane.embedding;

import com.openforge.memorylane.embedding.EmbeddingClient.EmbeddingDimensionMismatchException;
import com.openforge.memorylane.embedding.EmbeddingClient.EmbeddingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Embeds text with the local model, degrading to deterministic mock vectors.
 *
 * Fallback rules:
 *   disabled                     → mock, endpoint never probed
 *   health check negative        → mock (result cached for the health-check interval)
 *   endpoint error / unreachable → mock, warning logged, status marked unreachable
 *   dimension mismatch           → thrown, never masked
 *
 * A failed batch is retried one text at a time, so only the failing texts end up mock.
 */
@Slf4j
@Service
public class EmbeddingService {

    private final EmbeddingClient        client;
    private final MockEmbeddingGenerator mockGenerator;
    private final EmbeddingProperties    props;
    private final Clock                  clock;
    private final Duration               healthCheckInterval;

    private volatile Health health;

    public EmbeddingService(EmbeddingClient client,
                            MockEmbeddingGenerator mockGenerator,
                            EmbeddingProperties props,
                            Clock clock) {
        this.client              = client;
        this.mockGenerator       = mockGenerator;
        this.props               = props;
        this.clock               = clock;
        this.healthCheckInterval = Duration.ofSeconds(props.healthCheckIntervalSeconds());
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public FixedVector embed(String text) {
        requireText(text);
        if (!isReachable()) {
            return mockGenerator.generate(text);
        }
        try {
            return FixedVector.real(client.embed(text));
        } catch (EmbeddingDimensionMismatchException e) {
            throw e;
        } catch (EmbeddingException e) {
            degrade(e);
            return mockGenerator.generate(text);
        }
    }

    /** One vector per text, in input order. */
    public List<FixedVector> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        texts.forEach(EmbeddingService::requireText);

        if (!isReachable()) {
            return texts.stream().map(mockGenerator::generate).toList();
        }
        try {
            return client.embedAll(texts).stream().map(FixedVector::real).toList();
        } catch (EmbeddingDimensionMismatchException e) {
            throw e;
        } catch (EmbeddingException e) {
            log.warn("[Embed] Batch of {} failed ({}), retrying item by item", texts.size(), e.getMessage());
        }

        List<FixedVector> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            try {
                vectors.add(FixedVector.real(client.embed(text)));
            } catch (EmbeddingDimensionMismatchException e) {
                throw e;
            } catch (EmbeddingException e) {
                degrade(e);
                vectors.add(mockGenerator.generate(text));
            }
        }
        return vectors;
    }

    public EmbeddingStatus embeddingStatus() {
        boolean reachable = isReachable();
        return new EmbeddingStatus(
                reachable ? EmbeddingMode.REAL : EmbeddingMode.MOCK,
                props.dimensions(),
                reachable,
                props.model(),
                props.baseUrl());
    }

    // ── Health ───────────────────────────────────────────────────────────────

    private boolean isReachable() {
        if (!props.enabled()) {
            return false;
        }
        Instant now     = clock.instant();
        Health  current = health;
        if (current != null && current.checkedAt().plus(healthCheckInterval).isAfter(now)) {
            return current.reachable();
        }

        boolean reachable = client.isModelAvailable();
        if (!reachable) {
            log.warn("[Embed] Model {} not reachable at {}, using mock embeddings", props.model(), props.baseUrl());
        } else if (current == null || !current.reachable()) {
            log.info("[Embed] Model {} reachable at {}", props.model(), props.baseUrl());
        }
        health = new Health(reachable, now);
        return reachable;
    }

    private void degrade(EmbeddingException e) {
        log.warn("[Embed] Falling back to mock embedding: {}", e.getMessage());
        health = new Health(false, clock.instant());
    }

    private static void requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }
    }

    private record Health(boolean reachable, Instant checkedAt) {}
}
