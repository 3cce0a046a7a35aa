package com.openforge.memorylane.retrieval;

import com.openforge.memorylane.embedding.FixedVector;
import com.openforge.memorylane.memory.VectorEntry;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Exact cosine top-K over a set of stored vectors.
 *
 * Order: similarity desc, then newer first, then memory id asc.
 */
@Component
public class SimilarityRanker {

    static final Comparator<RankedSimilarity> ORDER =
            Comparator.comparingDouble(RankedSimilarity::similarity).reversed()
                    .thenComparing(RankedSimilarity::createdAt,
                            Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                    .thenComparing(RankedSimilarity::memoryId);

    public List<RankedSimilarity> rank(FixedVector query,
                                       List<VectorEntry> candidates,
                                       double threshold,
                                       int topK) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be >= 1, got " + topK);
        }
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        List<RankedSimilarity> hits = new ArrayList<>();
        for (VectorEntry entry : candidates) {
            double sim = cosine(query, entry.vector());
            if (sim >= threshold) {
                hits.add(new RankedSimilarity(entry.memoryId(), sim, entry.createdAt()));
            }
        }
        hits.sort(ORDER);
        return hits.size() > topK ? List.copyOf(hits.subList(0, topK)) : hits;
    }

    /**
     * dot(a, b) / (|a| |b|); 0 when either norm is zero.
     *
     * @throws IllegalArgumentException on a dimension mismatch
     */
    public static double cosine(FixedVector a, FixedVector b) {
        if (a.dimension() != b.dimension()) {
            throw new IllegalArgumentException("Dimension mismatch: %d vs %d"
                    .formatted(a.dimension(), b.dimension()));
        }
        double dot = 0.0, normA = 0.0, normB = 0.0;
        for (int i = 0; i < a.dimension(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot   += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        // single sqrt keeps cosine(v, v) exactly 1
        double sim = dot / Math.sqrt(normA * normB);
        return Math.max(-1.0, Math.min(1.0, sim));
    }
}
