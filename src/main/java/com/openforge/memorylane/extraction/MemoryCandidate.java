package com.openforge.memorylane.extraction;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A memory proposed by an extraction provider, before scoring and persistence.
 *
 * @param sourceChunkRef  chunk id ("session#index") the candidate was extracted from
 * @param relatedEntities entity names mentioned by the memory; order is irrelevant
 * @param rawConfidence   provider-reported confidence, 0–100
 * @param evidence        verbatim excerpts backing the memory
 */
@Builder
public record MemoryCandidate(
        MemoryType   type,
        String       category,
        String       title,
        String       content,
        String       sourceChunkRef,
        Set<String>  relatedEntities,
        int          rawConfidence,
        String       reasoning,
        List<String> evidence
) {

    public MemoryCandidate {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content cannot be null or blank");
        }
        if (rawConfidence < 0 || rawConfidence > 100) {
            throw new IllegalArgumentException("rawConfidence must be between 0 and 100");
        }
        relatedEntities = relatedEntities == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(relatedEntities));
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
