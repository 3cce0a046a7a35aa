package com.openforge.memorylane.session;

import com.openforge.memorylane.fixture.MemoryFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionChunkerTest {

    private final SessionChunker chunker = new SessionChunker();

    @Test
    @DisplayName("16 messages at size 15 split into chunks of 15 and 1")
    void chunk_lastChunkShorter() {
        List<ConversationChunk> chunks = chunker.chunk("s1", MemoryFixture.conversation(16), 15);

        assertThat(chunks).extracting(ConversationChunk::size).containsExactly(15, 1);
        assertThat(chunks).extracting(ConversationChunk::chunkIndex).containsExactly(0, 1);
        assertThat(chunks.get(1).chunkId()).isEqualTo("s1#1");
        assertThat(chunks.get(1).messages().get(0).content()).isEqualTo("answer 15");
    }

    @Test
    @DisplayName("chunks preserve order and never overlap")
    void chunk_preservesOrder() {
        List<Message> messages = MemoryFixture.conversation(7);

        List<ConversationChunk> chunks = chunker.chunk("s1", messages, 3);

        assertThat(chunks.stream().flatMap(c -> c.messages().stream()).toList()).isEqualTo(messages);
    }

    @Test
    @DisplayName("empty transcript yields no chunks")
    void chunk_empty() {
        assertThat(chunker.chunk("s1", List.of(), 15)).isEmpty();
    }

    @Test
    @DisplayName("chunk size below 1 is rejected")
    void chunk_invalidSize() {
        assertThatThrownBy(() -> chunker.chunk("s1", MemoryFixture.conversation(2), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("format renders User/Assistant lines separated by a blank line")
    void format_transcript() {
        ConversationChunk chunk = chunker.chunk("s1", MemoryFixture.conversation(2), 15).get(0);

        assertThat(chunker.format(chunk)).isEqualTo("User: question 0\n\nAssistant: answer 1");
    }
}
