package com.openforge.memorylane.memory;

import com.openforge.memorylane.embedding.EmbeddingService;
import com.openforge.memorylane.embedding.FixedVector;
import com.openforge.memorylane.extraction.ExtractionContext;
import com.openforge.memorylane.extraction.ExtractionProperties;
import com.openforge.memorylane.extraction.MemoryCandidate;
import com.openforge.memorylane.extraction.MemoryExtractionClient;
import com.openforge.memorylane.extraction.provider.ExtractionContextFactory;
import com.openforge.memorylane.retrieval.RankedSimilarity;
import com.openforge.memorylane.retrieval.SimilarityRanker;
import com.openforge.memorylane.scoring.ConfidenceScorer;
import com.openforge.memorylane.session.ConversationChunk;
import com.openforge.memorylane.session.Message;
import com.openforge.memorylane.session.SessionChunker;
import com.openforge.memorylane.session.SessionProperties;
import com.openforge.memorylane.session.SessionSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns a session transcript into stored memories.
 *
 * Per chunk, in order:
 *   extract candidates → score → embed → near-duplicate? merge : insert
 *
 * Chunks of one session run sequentially; {@link #extractSessions} runs
 * independent sessions in parallel on the extraction executor.
 */
@Slf4j
@Service
public class MemoryExtractionService {

    private final SessionSource            sessionSource;
    private final SessionChunker           chunker;
    private final SessionProperties        sessionProperties;
    private final MemoryExtractionClient   extractionClient;
    private final ExtractionContextFactory contextFactory;
    private final ConfidenceScorer         scorer;
    private final EmbeddingService         embeddingService;
    private final SimilarityRanker         similarityRanker;
    private final MemoryStore              memoryStore;
    private final ExtractionProperties     extractionProperties;
    private final ExecutorService          executor;
    private final Clock                    clock;

    /** Serialises duplicate check + write so parallel sessions cannot insert the same memory twice. */
    private final ReentrantLock dedupLock = new ReentrantLock();

    public MemoryExtractionService(SessionSource sessionSource,
                                   SessionChunker chunker,
                                   SessionProperties sessionProperties,
                                   MemoryExtractionClient extractionClient,
                                   ExtractionContextFactory contextFactory,
                                   ConfidenceScorer scorer,
                                   EmbeddingService embeddingService,
                                   SimilarityRanker similarityRanker,
                                   MemoryStore memoryStore,
                                   ExtractionProperties extractionProperties,
                                   @Qualifier("extractionExecutor") ExecutorService executor,
                                   Clock clock) {
        this.sessionSource        = sessionSource;
        this.chunker              = chunker;
        this.sessionProperties    = sessionProperties;
        this.extractionClient     = extractionClient;
        this.contextFactory       = contextFactory;
        this.scorer               = scorer;
        this.embeddingService     = embeddingService;
        this.similarityRanker     = similarityRanker;
        this.memoryStore          = memoryStore;
        this.extractionProperties = extractionProperties;
        this.executor             = executor;
        this.clock                = clock;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * @return number of new memories persisted; 0 both when nothing was found and
     *         when every provider failed (the extraction log tells them apart)
     */
    public int extract(String sessionId) {
        return extract(sessionId, null, CancellationSignal.none(), ProgressListener.NONE).newMemories();
    }

    /**
     * @param apiKey caller-supplied key for the messages API; null falls back to configuration
     * @throws SessionSource.SessionNotFoundException when the session does not exist
     */
    public ExtractionReport extract(String sessionId,
                                    String apiKey,
                                    CancellationSignal cancellation,
                                    ProgressListener progress) {
        List<Message>           messages = sessionSource.getMessages(sessionId);
        List<ConversationChunk> chunks   = chunker.chunk(sessionId, messages, sessionProperties.chunkSize());
        ExtractionContext       context  = contextFactory.create(apiKey);

        log.info("[Pipeline] Session {}: {} message(s) in {} chunk(s)", sessionId, messages.size(), chunks.size());

        int processed = 0, created = 0, merged = 0;
        boolean cancelled = false;

        for (ConversationChunk chunk : chunks) {
            if (cancellation.isCancelled()) {
                cancelled = true;
                log.info("[Pipeline] Session {} cancelled after {}/{} chunk(s)", sessionId, processed, chunks.size());
                break;
            }

            List<MemoryCandidate> candidates = extractionClient.extract(chunk, context);
            if (!candidates.isEmpty()) {
                List<FixedVector> vectors = embeddingService.embedBatch(
                        candidates.stream().map(MemoryCandidate::content).toList());
                for (int i = 0; i < candidates.size(); i++) {
                    if (persist(sessionId, candidates.get(i), vectors.get(i))) created++;
                    else merged++;
                }
            }

            processed++;
            progress.onProgress(processed, chunks.size());
        }

        ExtractionReport report = new ExtractionReport(sessionId, chunks.size(), processed, created, merged, cancelled);
        log.info("[Pipeline] Session {} done: new={} merged={} chunks={}/{}{}",
                sessionId, created, merged, processed, chunks.size(), cancelled ? " (cancelled)" : "");
        return report;
    }

    /**
     * Extracts several sessions concurrently. Sessions that fail (unknown id,
     * unreadable transcript) are logged and left out of the result.
     *
     * @return reports keyed by session id, in input order
     */
    public Map<String, ExtractionReport> extractSessions(List<String> sessionIds,
                                                         String apiKey,
                                                         CancellationSignal cancellation) {
        Map<String, CompletableFuture<ExtractionReport>> futures = new LinkedHashMap<>();
        for (String id : sessionIds) {
            futures.putIfAbsent(id, CompletableFuture.supplyAsync(
                    () -> extract(id, apiKey, cancellation, ProgressListener.NONE), executor));
        }

        Map<String, ExtractionReport> reports = new LinkedHashMap<>();
        futures.forEach((id, future) -> {
            try {
                reports.put(id, future.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("[Pipeline] Session {} failed: {}", id, cause.getMessage());
            }
        });
        return reports;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /** @return true when a new memory was inserted, false when merged into a duplicate */
    private boolean persist(String sessionId, MemoryCandidate candidate, FixedVector vector) {
        double  score = scorer.score(candidate.rawConfidence(), candidate.type(), candidate.content());
        Instant now   = clock.instant();

        dedupLock.lock();
        try {
            Optional<Memory> duplicate = findDuplicate(vector);
            if (duplicate.isPresent()) {
                Memory existing = duplicate.get();
                memoryStore.update(existing.observedAgain(candidate, score, now));
                log.debug("[Pipeline] '{}' merged into {} (seen {}x)",
                        candidate.title(), existing.id(), existing.timesObserved() + 1);
                return false;
            }
            Memory memory = memoryStore.save(Memory.fromCandidate(candidate, sessionId, score, vector, now));
            log.debug("[Pipeline] Stored {} memory {} '{}' confidence={}",
                    memory.type().wireName(), memory.id(), memory.title(), "%.2f".formatted(score));
            return true;
        } finally {
            dedupLock.unlock();
        }
    }

    private Optional<Memory> findDuplicate(FixedVector vector) {
        double threshold = extractionProperties.duplicateThreshold();
        if (threshold > 1.0) {
            return Optional.empty();
        }
        List<RankedSimilarity> best = similarityRanker.rank(vector, memoryStore.vectors(), threshold, 1);
        if (best.isEmpty()) {
            return Optional.empty();
        }
        return memoryStore.findById(best.get(0).memoryId());
    }
}
