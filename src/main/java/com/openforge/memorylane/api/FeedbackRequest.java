package com.openforge.memorylane.api;

import com.openforge.memorylane.memory.Feedback;
import jakarta.validation.constraints.NotNull;

/**
 * Body of POST /api/memories/{id}/feedback.
 *
 * { "feedback": "positive", "session_id": "abc" }
 */
public record FeedbackRequest(
        @NotNull Feedback feedback,
        String            sessionId
) {}
