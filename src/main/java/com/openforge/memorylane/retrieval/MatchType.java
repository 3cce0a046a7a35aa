package com.openforge.memorylane.retrieval;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which retrieval path found a memory. Declaration order is the tie-break order
 * at equal rank: both, then entity, then semantic.
 */
public enum MatchType {

    BOTH("both"),
    ENTITY("entity"),
    SEMANTIC("semantic");

    private final String wireName;

    MatchType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
