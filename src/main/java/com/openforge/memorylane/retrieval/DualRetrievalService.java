package com.openforge.memorylane.retrieval;

import com.openforge.memorylane.embedding.EmbeddingService;
import com.openforge.memorylane.embedding.FixedVector;
import com.openforge.memorylane.memory.Memory;
import com.openforge.memorylane.memory.MemoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Hybrid retrieval: literal entity/text matches merged with cosine similarity.
 *
 * Ranking:
 *   entity only    → 1.0
 *   semantic only  → similarity
 *   both           → 1.0 + similarity   (strictly above every single-path hit)
 *
 * Equal ranks break on match type (both > entity > semantic), then newer first,
 * then memory id. Never writes to the store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DualRetrievalService {

    static final double ENTITY_RANK = 1.0;

    private static final Comparator<Hit> ORDER =
            Comparator.comparingDouble(Hit::rank).reversed()
                    .thenComparing(Hit::matchType)
                    .thenComparing(Hit::createdAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                    .thenComparing(Hit::memoryId);

    private final MemoryStore      memoryStore;
    private final EmbeddingService embeddingService;
    private final SimilarityRanker similarityRanker;

    public List<RetrievalResult> retrieve(RetrievalQuery query) {
        if (memoryStore.count() == 0) {
            log.info("[Recall] query='{}' results=0 (empty store)", query.text());
            return List.of();
        }

        Map<String, Hit> hits = new LinkedHashMap<>();

        // ── Entity path ──────────────────────────────────────────────────────
        for (Memory memory : memoryStore.findByEntityOrText(query.entityFilters(), query.text())) {
            hits.put(memory.id(), new Hit(memory.id(), MatchType.ENTITY, ENTITY_RANK, null,
                    memory.createdAt(), memory));
        }

        // ── Semantic path ────────────────────────────────────────────────────
        String mode = "none";
        if (query.hasText()) {
            FixedVector queryVector = embeddingService.embed(query.text());
            mode = queryVector.mode().wireName();

            List<RankedSimilarity> ranked = similarityRanker.rank(
                    queryVector, memoryStore.vectors(), query.threshold(), Integer.MAX_VALUE);

            for (RankedSimilarity r : ranked) {
                Hit entity = hits.get(r.memoryId());
                if (entity != null) {
                    hits.put(r.memoryId(), new Hit(r.memoryId(), MatchType.BOTH,
                            ENTITY_RANK + r.similarity(), r.similarity(), entity.createdAt(), entity.memory()));
                } else {
                    hits.put(r.memoryId(), new Hit(r.memoryId(), MatchType.SEMANTIC,
                            r.similarity(), r.similarity(), r.createdAt(), null));
                }
            }
        }

        List<RetrievalResult> results = new ArrayList<>(Math.min(hits.size(), query.topK()));
        for (Hit hit : hits.values().stream().sorted(ORDER).toList()) {
            if (results.size() == query.topK()) break;
            Optional<Memory> memory = hit.memory() != null
                    ? Optional.of(hit.memory())
                    : memoryStore.findById(hit.memoryId());
            // deleted between the vector scan and now
            if (memory.isEmpty()) continue;
            results.add(new RetrievalResult(hit.memoryId(), hit.matchType(), hit.rank(),
                    hit.similarity(), memory.get()));
        }

        logRecall(query, results, mode);
        return results;
    }

    private void logRecall(RetrievalQuery query, List<RetrievalResult> results, String mode) {
        String top = results.stream()
                .limit(3)
                .map(r -> "%s:%.3f".formatted(r.matchType().wireName(), r.combinedRank()))
                .collect(Collectors.joining(", ", "[", "]"));
        log.info("[Recall] query='{}' filters={} results={} top={} embedding={}",
                query.text(), query.entityFilters(), results.size(), top, mode);
    }

    private record Hit(
            String    memoryId,
            MatchType matchType,
            double    rank,
            Double    similarity,
            Instant   createdAt,
            Memory    memory
    ) {}
}
