package com.openforge.memorylane.api;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;

import java.util.List;

/**
 * Body of POST /api/memories/retrieve.
 *
 * {
 *   "text": "wireless microphone",
 *   "entity_filters": ["wireless"],
 *   "threshold": 0.4,        // optional
 *   "top_k": 10,             // optional
 *   "auto_entities": false   // add entities guessed from text to entity_filters
 * }
 */
public record RetrieveRequest(
        String       text,
        List<String> entityFilters,
        @DecimalMin("0.0") @DecimalMax("1.0") Double threshold,
        @Min(1)      Integer topK,
        boolean      autoEntities
) {}
