package com.openforge.memorylane.embedding;

import java.util.List;

/**
 * Response from GET /api/tags: the models installed on the Ollama host.
 * Names carry a tag suffix ("mxbai-embed-large:latest").
 */
public record ModelTagsResponse(List<ModelTag> models) {

    public boolean contains(String model) {
        if (models == null || model == null) return false;
        return models.stream().anyMatch(t -> t.matches(model));
    }

    public record ModelTag(String name, String model) {

        boolean matches(String wanted) {
            return matchesName(name, wanted) || matchesName(model, wanted);
        }

        private static boolean matchesName(String actual, String wanted) {
            return actual != null && (actual.equals(wanted) || actual.startsWith(wanted + ":"));
        }
    }
}
