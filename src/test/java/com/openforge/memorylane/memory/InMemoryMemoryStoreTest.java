package com.openforge.memorylane.memory;

import com.openforge.memorylane.memory.MemoryStore.MemoryNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.openforge.memorylane.fixture.MemoryFixture.NOW;
import static com.openforge.memorylane.fixture.MemoryFixture.memory;
import static com.openforge.memorylane.fixture.MemoryFixture.vector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryMemoryStoreTest {

    private final InMemoryMemoryStore store = new InMemoryMemoryStore();

    @Test
    @DisplayName("saved memories come back by id, oldest first in listings")
    void save_findAll() {
        store.save(memory("b", "Second", Set.of(), vector(1f), NOW.plusSeconds(5)));
        store.save(memory("a", "First", Set.of(), vector(1f), NOW));

        assertThat(store.findById("a")).isPresent();
        assertThat(store.findAll()).extracting(Memory::id).containsExactly("a", "b");
        assertThat(store.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("entity filter matches case-insensitively on containment")
    void findByEntityOrText_entity() {
        store.save(memory("a", "Charging pad", Set.of("Wireless-Charging"), vector(1f), NOW));
        store.save(memory("b", "Pairing", Set.of("bluetooth"), vector(1f), NOW));

        assertThat(store.findByEntityOrText(List.of("wireless"), ""))
                .extracting(Memory::id).containsExactly("a");
    }

    @Test
    @DisplayName("text matches title or content")
    void findByEntityOrText_text() {
        store.save(memory("a", "Adopt Kafka", Set.of(), vector(1f), NOW));
        store.save(memory("b", "Use Postgres", Set.of(), vector(1f), NOW));

        assertThat(store.findByEntityOrText(List.of(), "KAFKA content"))
                .extracting(Memory::id).containsExactly("a");
    }

    @Test
    @DisplayName("no filters and no text match nothing")
    void findByEntityOrText_empty() {
        store.save(memory("a", "Adopt Kafka", Set.of("kafka"), vector(1f), NOW));

        assertThat(store.findByEntityOrText(List.of(), "  ")).isEmpty();
        assertThat(store.findByEntityOrText(null, null)).isEmpty();
    }

    @Test
    @DisplayName("update of an unknown id fails, delete reports whether anything was removed")
    void update_delete() {
        Memory m = memory("a", "Adopt Kafka", Set.of(), vector(1f), NOW);

        assertThatThrownBy(() -> store.update(m)).isInstanceOf(MemoryNotFoundException.class);

        store.save(m);
        assertThat(store.delete("a")).isTrue();
        assertThat(store.delete("a")).isFalse();
        assertThat(store.vectors()).isEmpty();
    }

    @Test
    @DisplayName("findBySession only returns that session's memories")
    void findBySession() {
        store.save(memory("a", "Adopt Kafka", Set.of(), vector(1f), NOW));
        store.save(memory("b", "Other", Set.of(), vector(1f), NOW).toBuilder().sessionId("s2").build());

        assertThat(store.findBySession("s2")).extracting(Memory::id).containsExactly("b");
        assertThat(store.findBySession("nope")).isEmpty();
    }

    @Test
    @DisplayName("feedback is stored on the memory; unknown ids fail")
    void recordFeedback() {
        store.save(memory("a", "Adopt Kafka", Set.of("kafka"), vector(1f), NOW));

        store.recordFeedback("a", Feedback.NEGATIVE);
        Memory updated = store.recordFeedback("a", Feedback.POSITIVE);

        assertThat(updated.positiveFeedback()).isEqualTo(1);
        assertThat(store.findById("a").orElseThrow().negativeFeedback()).isEqualTo(1);
        assertThatThrownBy(() -> store.recordFeedback("ghost", Feedback.POSITIVE))
                .isInstanceOf(MemoryNotFoundException.class);
    }
}
