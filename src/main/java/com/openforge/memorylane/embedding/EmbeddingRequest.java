package com.openforge.memorylane.embedding;

import java.util.List;

/**
 * Request body for POST /api/embed (Ollama).
 *
 * Wire format:
 * {
 *   "model": "mxbai-embed-large",
 *   "input": ["first text", "second text"]
 * }
 */
public record EmbeddingRequest(
        String       model,
        List<String> input
) {
    public static EmbeddingRequest of(String model, List<String> input) {
        return new EmbeddingRequest(model, List.copyOf(input));
    }
}
