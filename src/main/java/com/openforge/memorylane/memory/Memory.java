package com.openforge.memorylane.memory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.openforge.memorylane.embedding.FixedVector;
import com.openforge.memorylane.extraction.MemoryCandidate;
import com.openforge.memorylane.extraction.MemoryType;
import lombok.Builder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A persisted memory: a scored, embedded {@link MemoryCandidate} plus identity.
 *
 * Immutable. Two changes are sanctioned: {@link #observedAgain}, applied by the
 * extraction pipeline when a near-duplicate is extracted later, and
 * {@link #withFeedback}, applied by an explicit feedback call. Retrieval never
 * produces a modified copy.
 */
@Builder(toBuilder = true)
public record Memory(
        String        id,
        String        sessionId,
        MemoryType    type,
        String        category,
        String        title,
        String        content,
        String        sourceChunkRef,
        Set<String>   relatedEntities,
        int           rawConfidence,
        String        reasoning,
        List<String>  evidence,
        double        confidenceScore,
        @JsonIgnore
        FixedVector   embedding,
        Instant       createdAt,
        int           timesObserved,
        Instant       lastObservedAt,
        int           positiveFeedback,
        int           negativeFeedback
) {

    public Memory {
        if (id == null || id.isBlank())     throw new IllegalArgumentException("id must not be blank");
        if (type == null)                   throw new IllegalArgumentException("type must not be null");
        if (title == null || title.isBlank())     throw new IllegalArgumentException("title must not be blank");
        if (content == null || content.isBlank()) throw new IllegalArgumentException("content must not be blank");
        if (embedding == null)              throw new IllegalArgumentException("embedding must not be null");
        if (createdAt == null)              throw new IllegalArgumentException("createdAt must not be null");
        if (confidenceScore < 0.0 || confidenceScore > 1.0 || Double.isNaN(confidenceScore)) {
            throw new IllegalArgumentException("confidenceScore must be in [0, 1], got " + confidenceScore);
        }
        if (timesObserved < 1) timesObserved = 1;
        if (lastObservedAt == null) lastObservedAt = createdAt;
        if (positiveFeedback < 0) positiveFeedback = 0;
        if (negativeFeedback < 0) negativeFeedback = 0;
        relatedEntities = relatedEntities == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(relatedEntities));
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    /** First persistence of a candidate: fresh UUID, observed once. */
    public static Memory fromCandidate(MemoryCandidate candidate,
                                       String sessionId,
                                       double confidenceScore,
                                       FixedVector embedding,
                                       Instant now) {
        return Memory.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .type(candidate.type())
                .category(candidate.category())
                .title(candidate.title())
                .content(candidate.content())
                .sourceChunkRef(candidate.sourceChunkRef())
                .relatedEntities(candidate.relatedEntities())
                .rawConfidence(candidate.rawConfidence())
                .reasoning(candidate.reasoning())
                .evidence(candidate.evidence())
                .confidenceScore(confidenceScore)
                .embedding(embedding)
                .createdAt(now)
                .timesObserved(1)
                .lastObservedAt(now)
                .build();
    }

    /**
     * Folds a repeated observation into this memory: count +1, confidence is the
     * higher of the two, new evidence excerpts appended, entities unioned.
     */
    public Memory observedAgain(MemoryCandidate repeat, double repeatScore, Instant now) {
        List<String> mergedEvidence = new ArrayList<>(evidence);
        for (String excerpt : repeat.evidence()) {
            if (!mergedEvidence.contains(excerpt)) mergedEvidence.add(excerpt);
        }
        Set<String> mergedEntities = new LinkedHashSet<>(relatedEntities);
        mergedEntities.addAll(repeat.relatedEntities());

        return toBuilder()
                .timesObserved(timesObserved + 1)
                .lastObservedAt(now)
                .confidenceScore(Math.max(confidenceScore, repeatScore))
                .rawConfidence(Math.max(rawConfidence, repeat.rawConfidence()))
                .evidence(mergedEvidence)
                .relatedEntities(mergedEntities)
                .build();
    }

    /** One more helpful or unhelpful vote; nothing else changes. */
    public Memory withFeedback(Feedback feedback) {
        return switch (feedback) {
            case POSITIVE -> toBuilder().positiveFeedback(positiveFeedback + 1).build();
            case NEGATIVE -> toBuilder().negativeFeedback(negativeFeedback + 1).build();
        };
    }
}
