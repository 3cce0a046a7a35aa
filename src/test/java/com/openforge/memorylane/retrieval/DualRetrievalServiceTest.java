package com.openforge.memorylane.retrieval;

import com.openforge.memorylane.embedding.EmbeddingService;
import com.openforge.memorylane.memory.InMemoryMemoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static com.openforge.memorylane.fixture.MemoryFixture.NOW;
import static com.openforge.memorylane.fixture.MemoryFixture.memory;
import static com.openforge.memorylane.fixture.MemoryFixture.vector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DualRetrievalServiceTest {

    @Mock
    private EmbeddingService embeddingService;

    private InMemoryMemoryStore  store;
    private DualRetrievalService service;

    @BeforeEach
    void setUp() {
        store   = new InMemoryMemoryStore();
        service = new DualRetrievalService(store, embeddingService, new SimilarityRanker());
    }

    @Test
    @DisplayName("empty store returns nothing without embedding the query")
    void retrieve_emptyStore() {
        List<RetrievalResult> results = service.retrieve(new RetrievalQuery("anything", List.of("x"), 0.4, 10));

        assertThat(results).isEmpty();
        verify(embeddingService, never()).embed(anyString());
    }

    @Test
    @DisplayName("entity hit ranks above a strong semantic-only hit")
    void retrieve_entityAboveSemantic() {
        store.save(memory("A", "Charging pad vendor", Set.of("wireless-charging"), vector(0f, 1f), NOW));
        store.save(memory("B", "Bluetooth pairing flow", Set.of("bluetooth"), vector(0.82f, 0.5724f), NOW));
        when(embeddingService.embed("radio links")).thenReturn(vector(1f, 0f));

        List<RetrievalResult> results = service.retrieve(
                new RetrievalQuery("radio links", List.of("wireless"), 0.4, 10));

        assertThat(results).extracting(RetrievalResult::memoryId).containsExactly("A", "B");
        assertThat(results.get(0).matchType()).isEqualTo(MatchType.ENTITY);
        assertThat(results.get(0).combinedRank()).isEqualTo(1.0);
        assertThat(results.get(0).similarity()).isNull();
        assertThat(results.get(1).matchType()).isEqualTo(MatchType.SEMANTIC);
        assertThat(results.get(1).combinedRank()).isCloseTo(0.82, within(1e-3));
    }

    @Test
    @DisplayName("wireless microphone: entity match at 1.0 precedes a 0.82 semantic match")
    void retrieve_wirelessMicrophone() {
        store.save(memory("A", "Receiver channel plan", Set.of("wireless"), vector(0f, 1f), NOW));
        store.save(memory("B", "Audio input gain", Set.of("audio"), vector(0.82f, 0.5724f), NOW));
        when(embeddingService.embed("wireless microphone")).thenReturn(vector(1f, 0f));

        List<RetrievalResult> results = service.retrieve(
                new RetrievalQuery("wireless microphone", List.of("wireless"), 0.4, 10));

        assertThat(results).extracting(RetrievalResult::memoryId).containsExactly("A", "B");
        assertThat(results.get(0).matchType()).isEqualTo(MatchType.ENTITY);
        assertThat(results.get(0).combinedRank()).isEqualTo(1.0);
        assertThat(results.get(1).matchType()).isEqualTo(MatchType.SEMANTIC);
        assertThat(results.get(1).similarity()).isCloseTo(0.82, within(1e-3));
        assertThat(results.get(1).combinedRank()).isCloseTo(0.82, within(1e-3));
    }

    @Test
    @DisplayName("hit found by both paths outranks every single-path hit")
    void retrieve_bothOutranks() {
        store.save(memory("A", "Entity only", Set.of("wireless"), vector(0f, 1f), NOW));
        store.save(memory("C", "Both paths", Set.of("wireless"), vector(1f, 0.2f), NOW));
        store.save(memory("D", "Semantic only", Set.of(), vector(1f, 0f), NOW));
        when(embeddingService.embed("radio links")).thenReturn(vector(1f, 0f));

        List<RetrievalResult> results = service.retrieve(
                new RetrievalQuery("radio links", List.of("wireless"), 0.4, 10));

        assertThat(results).extracting(RetrievalResult::memoryId).containsExactly("C", "A", "D");
        assertThat(results.get(0).matchType()).isEqualTo(MatchType.BOTH);
        assertThat(results.get(0).combinedRank()).isGreaterThan(1.9);
        assertThat(results.get(0).similarity()).isNotNull();
    }

    @Test
    @DisplayName("entity hit wins a tie against a semantic similarity of 1.0")
    void retrieve_tieFavoursEntity() {
        store.save(memory("S", "Semantic twin", Set.of(), vector(1f, 0f), NOW.plusSeconds(60)));
        store.save(memory("E", "Entity", Set.of("wireless"), vector(0f, 1f), NOW));
        when(embeddingService.embed("radio links")).thenReturn(vector(1f, 0f));

        List<RetrievalResult> results = service.retrieve(
                new RetrievalQuery("radio links", List.of("wireless"), 0.4, 10));

        assertThat(results).extracting(RetrievalResult::memoryId).containsExactly("E", "S");
    }

    @Test
    @DisplayName("results are truncated to topK")
    void retrieve_topK() {
        store.save(memory("A", "One", Set.of("wireless"), vector(0f, 1f), NOW));
        store.save(memory("B", "Two", Set.of("wireless"), vector(0f, 1f), NOW.plusSeconds(1)));
        store.save(memory("C", "Three", Set.of("wireless"), vector(0f, 1f), NOW.plusSeconds(2)));

        List<RetrievalResult> results = service.retrieve(new RetrievalQuery("", List.of("wireless"), 0.4, 2));

        assertThat(results).extracting(RetrievalResult::memoryId).containsExactly("C", "B");
        verify(embeddingService, never()).embed(anyString());
    }

    @Test
    @DisplayName("query text matching a title counts as an entity-path hit")
    void retrieve_textMatch() {
        store.save(memory("A", "Adopt Kafka for events", Set.of(), vector(0f, 1f), NOW));
        when(embeddingService.embed("kafka")).thenReturn(vector(1f, 0f));

        List<RetrievalResult> results = service.retrieve(new RetrievalQuery("kafka", List.of(), 0.4, 10));

        assertThat(results).singleElement()
                .satisfies(r -> assertThat(r.matchType()).isEqualTo(MatchType.ENTITY));
    }

    @Test
    @DisplayName("retrieval never modifies stored memories")
    void retrieve_readOnly() {
        store.save(memory("A", "Entity only", Set.of("wireless"), vector(1f, 0f), NOW));
        when(embeddingService.embed("radio")).thenReturn(vector(1f, 0f));

        service.retrieve(new RetrievalQuery("radio", List.of("wireless"), 0.0, 10));

        assertThat(store.findById("A")).get()
                .satisfies(m -> assertThat(m.timesObserved()).isEqualTo(1));
        assertThat(store.count()).isEqualTo(1);
    }
}
