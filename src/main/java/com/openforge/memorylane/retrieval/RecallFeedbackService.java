package com.openforge.memorylane.retrieval;

import com.openforge.memorylane.memory.Feedback;
import com.openforge.memorylane.memory.Memory;
import com.openforge.memorylane.memory.MemoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Records whether a recalled memory helped. Kept apart from
 * {@link DualRetrievalService}, which stays read-only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecallFeedbackService {

    private final MemoryStore memoryStore;

    /**
     * @param sessionId session the recall happened in; logged only, may be null
     * @throws IllegalArgumentException if the id or feedback is missing
     * @throws MemoryStore.MemoryNotFoundException if no memory has this id
     */
    public Memory submitFeedback(String memoryId, String sessionId, Feedback feedback) {
        if (memoryId == null || memoryId.isBlank()) {
            throw new IllegalArgumentException("memoryId must not be blank");
        }
        if (feedback == null) {
            throw new IllegalArgumentException("feedback must be \"positive\" or \"negative\"");
        }
        Memory updated = memoryStore.recordFeedback(memoryId, feedback);
        log.info("[Recall] feedback memory={} session={} type={} (+{} / -{})",
                memoryId, sessionId, feedback.wireName(),
                updated.positiveFeedback(), updated.negativeFeedback());
        return updated;
    }
}
