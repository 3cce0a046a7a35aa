package com.openforge.memorylane.retrieval;

import com.openforge.memorylane.memory.Memory;

/**
 * One ranked hit.
 *
 * @param combinedRank 1.0 for entity hits, the similarity for semantic hits,
 *                     1.0 + similarity for hits found by both paths
 * @param similarity   null for pure entity hits
 */
public record RetrievalResult(
        String    memoryId,
        MatchType matchType,
        double    combinedRank,
        Double    similarity,
        Memory    memory
) {}
