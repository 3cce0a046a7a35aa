package com.openforge.memorylane.session;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Splits a transcript into fixed-size, non-overlapping windows.
 *
 * Windows are cut purely by message count; the last window may be shorter.
 * Context that spans a window boundary is not carried over.
 */
@Component
public class SessionChunker {

    public List<ConversationChunk> chunk(String sessionId, List<Message> messages, int maxChunkSize) {
        if (maxChunkSize < 1) {
            throw new IllegalArgumentException("maxChunkSize must be >= 1, got " + maxChunkSize);
        }
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }

        List<ConversationChunk> chunks = new ArrayList<>();
        for (int from = 0, index = 0; from < messages.size(); from += maxChunkSize, index++) {
            int to = Math.min(from + maxChunkSize, messages.size());
            chunks.add(new ConversationChunk(sessionId, index, messages.subList(from, to)));
        }
        return chunks;
    }

    /**
     * Renders a chunk as the plain-text transcript sent to the extraction providers:
     * "User: …" / "Assistant: …" lines separated by a blank line.
     */
    public String format(ConversationChunk chunk) {
        return chunk.messages().stream()
                .map(m -> (m.isUser() ? "User" : "Assistant") + ": " + m.content())
                .collect(Collectors.joining("\n\n"));
    }
}
