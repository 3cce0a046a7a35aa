package com.openforge.memorylane.retrieval;

import com.openforge.memorylane.embedding.FixedVector;
import com.openforge.memorylane.memory.VectorEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.openforge.memorylane.fixture.MemoryFixture.NOW;
import static com.openforge.memorylane.fixture.MemoryFixture.vector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SimilarityRankerTest {

    private final SimilarityRanker ranker = new SimilarityRanker();

    @Test
    @DisplayName("a vector is fully similar to itself")
    void cosine_self() {
        FixedVector v = vector(0.3f, -1.2f, 4.5f);
        assertThat(SimilarityRanker.cosine(v, v)).isEqualTo(1.0);

        for (FixedVector w : List.of(vector(0.1f, 0.2f, 0.3f), vector(-7.25f, 3.1f, 0.004f), vector(1e-3f, 9e3f, -42f))) {
            assertThat(SimilarityRanker.cosine(w, w)).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("zero vector has similarity 0")
    void cosine_zero() {
        assertThat(SimilarityRanker.cosine(vector(1f, 2f), vector(0f, 0f))).isZero();
    }

    @Test
    @DisplayName("opposite vectors have similarity -1")
    void cosine_opposite() {
        assertThat(SimilarityRanker.cosine(vector(1f, 0f), vector(-1f, 0f))).isCloseTo(-1.0, within(1e-9));
    }

    @Test
    @DisplayName("dimension mismatch is rejected")
    void cosine_mismatch() {
        assertThatThrownBy(() -> SimilarityRanker.cosine(vector(1f, 0f), vector(1f, 0f, 0f)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2 vs 3");
    }

    @Test
    @DisplayName("hits below the threshold are dropped and the rest sorted descending")
    void rank_thresholdAndOrder() {
        List<VectorEntry> entries = List.of(
                new VectorEntry("far",   vector(0f, 1f),    NOW),
                new VectorEntry("near",  vector(1f, 0.1f),  NOW),
                new VectorEntry("exact", vector(2f, 0f),    NOW));

        List<RankedSimilarity> ranked = ranker.rank(vector(1f, 0f), entries, 0.5, 10);

        assertThat(ranked).extracting(RankedSimilarity::memoryId).containsExactly("exact", "near");
    }

    @Test
    @DisplayName("equal similarity breaks on newer first, then id")
    void rank_ties() {
        List<VectorEntry> entries = List.of(
                new VectorEntry("b-old", vector(1f, 0f), NOW.minusSeconds(60)),
                new VectorEntry("z-new", vector(1f, 0f), NOW),
                new VectorEntry("a-old", vector(1f, 0f), NOW.minusSeconds(60)));

        List<RankedSimilarity> ranked = ranker.rank(vector(1f, 0f), entries, 0.0, 10);

        assertThat(ranked).extracting(RankedSimilarity::memoryId).containsExactly("z-new", "a-old", "b-old");
    }

    @Test
    @DisplayName("result is truncated to topK")
    void rank_topK() {
        List<VectorEntry> entries = List.of(
                new VectorEntry("a", vector(1f, 0f),   NOW),
                new VectorEntry("b", vector(1f, 0.5f), NOW),
                new VectorEntry("c", vector(1f, 1f),   NOW));

        assertThat(ranker.rank(vector(1f, 0f), entries, 0.0, 2))
                .extracting(RankedSimilarity::memoryId).containsExactly("a", "b");
    }

    @Test
    @DisplayName("topK below 1 is rejected, empty input gives empty output")
    void rank_edges() {
        assertThatThrownBy(() -> ranker.rank(vector(1f), List.of(), 0.0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(ranker.rank(vector(1f), List.of(), 0.0, 5)).isEmpty();
    }
}
