package com.openforge.memorylane.retrieval;

import java.util.List;
import java.util.Objects;

/**
 * A hybrid retrieval request.
 *
 * @param text          free text; drives the semantic path and the title/content scan
 * @param entityFilters literal entity terms, possibly empty
 * @param threshold     minimum cosine similarity for a semantic hit, in [0, 1]
 * @param topK          maximum number of results, at least 1
 */
public record RetrievalQuery(
        String       text,
        List<String> entityFilters,
        double       threshold,
        int          topK
) {

    public RetrievalQuery {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in [0, 1], got " + threshold);
        }
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be >= 1, got " + topK);
        }
        text = text == null ? "" : text;
        entityFilters = entityFilters == null
                ? List.of()
                : entityFilters.stream().filter(Objects::nonNull).toList();
    }

    public boolean hasText() {
        return !text.isBlank();
    }
}
