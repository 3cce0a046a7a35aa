package com.openforge.memorylane.extraction;

import java.util.List;

/**
 * Result of extracting one chunk, mirroring the structured log line.
 *
 * @param chosenMethod "cli", "api" or "none"
 * @param error        null on success; "no_provider" when nothing could be tried
 */
public record ExtractionOutcome(
        String                chosenMethod,
        String                chunkId,
        boolean               success,
        List<MemoryCandidate> candidates,
        String                error
) {

    public static final String NO_PROVIDER = "no_provider";

    public ExtractionOutcome {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static ExtractionOutcome success(ProviderKind kind, String chunkId, List<MemoryCandidate> candidates) {
        return new ExtractionOutcome(kind.method(), chunkId, true, candidates, null);
    }

    public static ExtractionOutcome failure(String method, String chunkId, String error) {
        return new ExtractionOutcome(method, chunkId, false, List.of(), error);
    }

    public int memoryCount() {
        return candidates.size();
    }
}
