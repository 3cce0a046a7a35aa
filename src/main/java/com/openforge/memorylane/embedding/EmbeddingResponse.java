package com.openforge.memorylane.embedding;

import java.util.List;

/**
 * Response from POST /api/embed.
 *
 * Wire format:
 * {
 *   "model": "mxbai-embed-large",
 *   "embeddings": [[0.1, -0.2, ...], [...]]
 * }
 */
public record EmbeddingResponse(
        String            model,
        List<List<Float>> embeddings
) {

    public int count() {
        return embeddings == null ? 0 : embeddings.size();
    }
}
