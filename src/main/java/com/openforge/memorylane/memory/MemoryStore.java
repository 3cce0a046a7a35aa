package com.openforge.memorylane.memory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port for memories.
 *
 * Writes to one store instance are serialised; reads see a snapshot and may miss
 * a write that is still in flight.
 */
public interface MemoryStore {

    /** Inserts, or replaces a memory with the same id. */
    Memory save(Memory memory);

    /** Replaces an existing memory. */
    Memory update(Memory memory);

    /**
     * Adds one feedback vote to a stored memory and returns the updated copy.
     *
     * @throws MemoryNotFoundException if no memory has this id
     */
    Memory recordFeedback(String id, Feedback feedback);

    Optional<Memory> findById(String id);

    boolean delete(String id);

    List<Memory> findAll();

    List<Memory> findBySession(String sessionId);

    long count();

    /**
     * Memories with a related entity equal to or containing any of {@code entityFilters},
     * or whose title/content contains {@code text}. Case-insensitive.
     */
    List<Memory> findByEntityOrText(Collection<String> entityFilters, String text);

    /** Every stored (id, vector, created_at) triple. */
    List<VectorEntry> vectors();

    class MemoryNotFoundException extends RuntimeException {
        public MemoryNotFoundException(String id) {
            super("Memory not found: " + id);
        }
    }
}
