package com.openforge.memorylane.memory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default store: a concurrent map behind a single write lock.
 * Reads iterate the map without locking and may miss a concurrent write.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "memorylane.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryMemoryStore implements MemoryStore {

    private static final Comparator<Memory> OLDEST_FIRST =
            Comparator.comparing(Memory::createdAt).thenComparing(Memory::id);

    private final Map<String, Memory> memories  = new ConcurrentHashMap<>();
    private final ReentrantLock       writeLock = new ReentrantLock();

    @Override
    public Memory save(Memory memory) {
        writeLock.lock();
        try {
            memories.put(memory.id(), memory);
        } finally {
            writeLock.unlock();
        }
        log.debug("[Store] Saved memory {} ({})", memory.id(), memory.type().wireName());
        return memory;
    }

    @Override
    public Memory update(Memory memory) {
        writeLock.lock();
        try {
            if (!memories.containsKey(memory.id())) {
                throw new MemoryNotFoundException(memory.id());
            }
            memories.put(memory.id(), memory);
        } finally {
            writeLock.unlock();
        }
        return memory;
    }

    @Override
    public Memory recordFeedback(String id, Feedback feedback) {
        writeLock.lock();
        try {
            Memory current = id == null ? null : memories.get(id);
            if (current == null) {
                throw new MemoryNotFoundException(id);
            }
            Memory updated = current.withFeedback(feedback);
            memories.put(id, updated);
            return updated;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<Memory> findById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(memories.get(id));
    }

    @Override
    public boolean delete(String id) {
        if (id == null) return false;
        writeLock.lock();
        try {
            return memories.remove(id) != null;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<Memory> findAll() {
        return memories.values().stream().sorted(OLDEST_FIRST).toList();
    }

    @Override
    public List<Memory> findBySession(String sessionId) {
        return memories.values().stream()
                .filter(m -> sessionId != null && sessionId.equals(m.sessionId()))
                .sorted(OLDEST_FIRST)
                .toList();
    }

    @Override
    public long count() {
        return memories.size();
    }

    @Override
    public List<Memory> findByEntityOrText(Collection<String> entityFilters, String text) {
        MemoryMatcher matcher = MemoryMatcher.of(entityFilters, text);
        if (matcher.isEmpty()) return List.of();
        return memories.values().stream()
                .filter(matcher::matches)
                .sorted(OLDEST_FIRST)
                .toList();
    }

    @Override
    public List<VectorEntry> vectors() {
        return memories.values().stream().map(VectorEntry::of).toList();
    }
}
