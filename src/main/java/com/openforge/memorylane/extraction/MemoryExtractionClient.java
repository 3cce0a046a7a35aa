package com.openforge.memorylane.extraction;

import com.openforge.memorylane.session.ConversationChunk;
import com.openforge.memorylane.session.SessionChunker;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts memory candidates from one conversation chunk.
 *
 * Call graph:
 *
 *   extractChunk(chunk, context)
 *     └─ localAgent.checkStatus()                    (fresh on every call)
 *     └─ ExtractionContext.plan(status, keyPresent)  → [CLI, API] / [CLI] / [API] / []
 *     └─ for each kind in plan:
 *           breaker(kind) → provider.send(system, user, timeout) → parser.parse(reply)
 *           first success wins; any failure falls through to the next kind
 *
 * Never throws. Every call ends in exactly one structured log line
 * {@code chosen_method chunk_id success memory_count error}.
 */
@Slf4j
@Component
public class MemoryExtractionClient {

    private static final String NONE = "none";

    private final SessionChunker                    chunker;
    private final CandidateParser                   parser;
    private final Map<ProviderKind, CircuitBreaker> breakers = new EnumMap<>(ProviderKind.class);

    public MemoryExtractionClient(SessionChunker chunker,
                                  CandidateParser parser,
                                  CircuitBreaker cliExtractionCircuitBreaker,
                                  CircuitBreaker apiExtractionCircuitBreaker) {
        this.chunker = chunker;
        this.parser  = parser;
        this.breakers.put(ProviderKind.CLI, cliExtractionCircuitBreaker);
        this.breakers.put(ProviderKind.API, apiExtractionCircuitBreaker);
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public List<MemoryCandidate> extract(ConversationChunk chunk, ExtractionContext context) {
        return extractChunk(chunk, context).candidates();
    }

    public ExtractionOutcome extractChunk(ConversationChunk chunk, ExtractionContext context) {
        ExtractionOutcome outcome;
        try {
            outcome = run(chunk, context);
        } catch (RuntimeException e) {
            log.error("[Extract] Unexpected failure on chunk {}: {}", chunk.chunkId(), e.getMessage(), e);
            outcome = ExtractionOutcome.failure(NONE, chunk.chunkId(), e.getClass().getSimpleName());
        }

        log.info("[Extract] chosen_method={} chunk_id={} success={} memory_count={} error={}",
                outcome.chosenMethod(), outcome.chunkId(), outcome.success(),
                outcome.memoryCount(), outcome.error());
        return outcome;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private ExtractionOutcome run(ConversationChunk chunk, ExtractionContext context) {
        String chunkId = chunk.chunkId();

        LocalAgentProvider.Status status = context.localAgent() == null
                ? LocalAgentProvider.Status.unavailable("disabled")
                : context.localAgent().checkStatus();
        List<ProviderKind> plan = ExtractionContext.plan(status, context.keyedApi() != null);

        if (plan.isEmpty()) {
            log.warn("[Extract] No usable provider for chunk {} (cli: {}, api key: absent)",
                    chunkId, status.detail());
            return ExtractionOutcome.failure(NONE, chunkId, ExtractionOutcome.NO_PROVIDER);
        }

        String systemPrompt = ExtractionPrompt.system();
        String userPrompt   = ExtractionPrompt.user(chunker.format(chunk));

        List<String> errors = new ArrayList<>();
        ProviderKind last   = plan.get(0);
        for (ProviderKind kind : plan) {
            last = kind;
            try {
                ExtractionProvider provider = context.provider(kind);
                List<MemoryCandidate> candidates = breakers.get(kind).executeSupplier(() ->
                        parser.parse(provider.send(systemPrompt, userPrompt, context.timeout(kind)), chunkId));
                return ExtractionOutcome.success(kind, chunkId, candidates);
            } catch (CallNotPermittedException e) {
                errors.add("%s: circuit open".formatted(kind.method()));
                log.warn("[Extract] {} circuit is open, skipping for chunk {}", kind.method(), chunkId);
            } catch (RuntimeException e) {
                errors.add("%s: %s".formatted(kind.method(), e.getMessage()));
                log.warn("[Extract] {} provider failed on chunk {} ({}): {}",
                        kind.method(), chunkId, e.getClass().getSimpleName(), e.getMessage());
            }
        }
        return ExtractionOutcome.failure(last.method(), chunkId, String.join("; ", errors));
    }
}
