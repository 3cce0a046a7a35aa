package com.openforge.memorylane.memory;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Literal matching shared by every {@link MemoryStore} implementation.
 */
public final class MemoryMatcher {

    private final List<String> filters;
    private final String       text;

    private MemoryMatcher(List<String> filters, String text) {
        this.filters = filters;
        this.text    = text;
    }

    public static MemoryMatcher of(Collection<String> entityFilters, String text) {
        List<String> filters = entityFilters == null ? List.of() : entityFilters.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(f -> !f.isEmpty())
                .map(MemoryMatcher::lower)
                .toList();
        String needle = text == null || text.isBlank() ? null : lower(text.trim());
        return new MemoryMatcher(filters, needle);
    }

    /** True when nothing could ever match. */
    public boolean isEmpty() {
        return filters.isEmpty() && text == null;
    }

    public boolean matches(Memory memory) {
        return matchesEntity(memory) || matchesText(memory);
    }

    private boolean matchesEntity(Memory memory) {
        if (filters.isEmpty()) return false;
        for (String entity : memory.relatedEntities()) {
            String value = lower(entity);
            for (String filter : filters) {
                if (value.contains(filter)) return true;
            }
        }
        return false;
    }

    private boolean matchesText(Memory memory) {
        if (text == null) return false;
        return lower(memory.title()).contains(text) || lower(memory.content()).contains(text);
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
