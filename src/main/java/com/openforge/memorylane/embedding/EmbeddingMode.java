package com.openforge.memorylane.embedding;

import com.fasterxml.jackson.annotation.JsonValue;

/** Where a vector came from: the embedding model, or the deterministic placeholder. */
public enum EmbeddingMode {

    REAL("real"),
    MOCK("mock");

    private final String wireName;

    EmbeddingMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
