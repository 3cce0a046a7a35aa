package com.openforge.memorylane.memory;

/**
 * Summary of one session's extraction run.
 *
 * @param mergedMemories candidates folded into an existing near-duplicate
 * @param cancelled      true when the run stopped at a chunk boundary before the end
 */
public record ExtractionReport(
        String  sessionId,
        int     totalChunks,
        int     processedChunks,
        int     newMemories,
        int     mergedMemories,
        boolean cancelled
) {}
