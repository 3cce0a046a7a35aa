package com.openforge.memorylane.extraction;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt templates shared by every extraction provider.
 *
 * The system prompt is built once from {@link MemoryType}; both transports send
 * it byte-for-byte, only the way it is delivered differs.
 */
public final class ExtractionPrompt {

    private static final List<String> TRIGGERS = List.of(
            "Recovery patterns: error -> workaround -> success",
            "User corrections: \"I want it this other way\"",
            "Enthusiasm: \"that's exactly what I wanted!\"",
            "Negative reactions: \"never do that\"",
            "Repeated requests: same workflow multiple times",
            "Strong sentiment: \"always\", \"never\", \"must\", \"critical\"",
            "Explicit preferences: \"I prefer\", \"I like\", \"I want\""
    );

    private static final String SYSTEM_TEMPLATE = """
        You are analyzing a conversation between a user and an AI assistant to extract memorable moments.

        Your task is to identify consequential decisions, corrections, insights, and patterns that should be remembered for future sessions.

        MEMORY TYPES (extract only clear examples):

        HIGH PRIORITY:
        %s

        MEDIUM PRIORITY:
        %s

        LOWER PRIORITY:
        %s

        TRIGGERS TO WATCH:
        %s

        For each memory found, return:
        {
          "type": "memory_type",
          "category": "specific-category-slug",
          "title": "Brief title (5-10 words)",
          "content": "Detailed description of what happened and why it matters",
          "source_chunk": "Exact relevant excerpt from conversation",
          "related_entities": [
            {"type": "person|project|business", "raw": "Name as mentioned", "slug": "normalized-name"}
          ],
          "confidence_score": 0-100,
          "reasoning": "Why this is worth remembering"
        }

        IMPORTANT:
        - Only extract clear, unambiguous memories
        - Provide concrete evidence in source_chunk
        - Be conservative - better to miss some than create noise
        - Return empty array if no strong memories found
        - Return valid JSON array only, no other text
        """;

    private static final String USER_PREFIX = "Analyze this conversation and extract memories:\n\n";

    private static final String SYSTEM_PROMPT = SYSTEM_TEMPLATE.formatted(
            typesOf(MemoryType.Priority.HIGH),
            typesOf(MemoryType.Priority.MEDIUM),
            typesOf(MemoryType.Priority.LOW),
            TRIGGERS.stream().map(t -> "- " + t).collect(Collectors.joining("\n")));

    private ExtractionPrompt() {
    }

    public static String system() {
        return SYSTEM_PROMPT;
    }

    public static String user(String formattedChunk) {
        return USER_PREFIX + formattedChunk;
    }

    private static String typesOf(MemoryType.Priority priority) {
        return Arrays.stream(MemoryType.values())
                .filter(t -> t.priority() == priority)
                .map(t -> "  - %s: %s".formatted(t.wireName(), t.description()))
                .collect(Collectors.joining("\n"));
    }
}
