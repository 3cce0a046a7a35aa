package com.openforge.memorylane.session;

import java.util.List;

/**
 * A bounded, non-overlapping slice of one session transcript.
 * Produced by {@link SessionChunker}, consumed once by the extraction client, never persisted.
 *
 * @param sessionId  session the messages were read from
 * @param chunkIndex 0-based, contiguous within a session
 * @param messages   ordered messages of this slice (never empty)
 */
public record ConversationChunk(
        String        sessionId,
        int           chunkIndex,
        List<Message> messages
) {

    public ConversationChunk {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        if (chunkIndex < 0) {
            throw new IllegalArgumentException("chunkIndex must be >= 0");
        }
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    /** Stable reference used in logs and stored on each memory as its source. */
    public String chunkId() {
        return sessionId + "#" + chunkIndex;
    }

    public int size() {
        return messages.size();
    }
}
