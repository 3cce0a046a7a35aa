package com.openforge.memorylane.memory;

import com.openforge.memorylane.embedding.FixedVector;

import java.time.Instant;

/** The slice of a memory the similarity ranker needs. */
public record VectorEntry(String memoryId, FixedVector vector, Instant createdAt) {

    public static VectorEntry of(Memory memory) {
        return new VectorEntry(memory.id(), memory.embedding(), memory.createdAt());
    }
}
