package com.openforge.memorylane.embedding;

/**
 * Snapshot of the embedding path, as reported to callers and the startup banner.
 *
 * @param mode      the mode the next {@code embed} call would use
 * @param reachable last health-check result; always false when embedding is disabled
 */
public record EmbeddingStatus(
        EmbeddingMode mode,
        int           dimension,
        boolean       reachable,
        String        model,
        String        endpoint
) {}
