package com.openforge.memorylane.extraction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Classifies a memory distilled from a conversation.
 *
 * HIGH    : correction, decision, commitment      (always worth extracting)
 * MEDIUM  : insight, learning, confidence          (extract if clear)
 * LOW     : pattern_seed, cross_agent, workflow_note, gap (context dependent)
 *
 * The wire name is the lower-case snake form used in the extraction prompt
 * and in provider replies ("pattern_seed", not "PATTERN_SEED").
 */
public enum MemoryType {

    CORRECTION   ("User corrected agent behavior",      Priority.HIGH),
    DECISION     ("Explicit choice with reasoning",     Priority.HIGH),
    COMMITMENT   ("User preference expressed",          Priority.HIGH),
    INSIGHT      ("Non-obvious discovery",              Priority.MEDIUM),
    LEARNING     ("New knowledge gained",               Priority.MEDIUM),
    CONFIDENCE   ("Strong confidence in approach",      Priority.MEDIUM),
    PATTERN_SEED ("Repeated behavior to formalize",     Priority.LOW),
    CROSS_AGENT  ("Info relevant to other agents",      Priority.LOW),
    WORKFLOW_NOTE("Process observation",                Priority.LOW),
    GAP          ("Missing capability or limitation",   Priority.LOW);

    public enum Priority {
        HIGH(0.15), MEDIUM(0.10), LOW(0.05);

        private final double boost;

        Priority(double boost) {
            this.boost = boost;
        }

        public double boost() {
            return boost;
        }
    }

    private final String   description;
    private final Priority priority;

    MemoryType(String description, Priority priority) {
        this.description = description;
        this.priority    = priority;
    }

    public String description() {
        return description;
    }

    public Priority priority() {
        return priority;
    }

    /** Additive confidence boost applied by the scorer. */
    public double boost() {
        return priority.boost();
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient lookup for provider output: trims, ignores case, accepts '-' for '_'. */
    public static Optional<MemoryType> fromWireName(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (MemoryType type : values()) {
            if (type.name().equals(normalized)) return Optional.of(type);
        }
        return Optional.empty();
    }

    @JsonCreator
    static MemoryType fromJson(String raw) {
        return fromWireName(raw)
                .orElseThrow(() -> new IllegalArgumentException("Unknown memory type: " + raw));
    }
}
