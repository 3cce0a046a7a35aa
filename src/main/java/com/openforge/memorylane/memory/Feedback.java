package com.openforge.memorylane.memory;

import com.fasterxml.jackson.annotation.JsonValue;

/** Whether a recalled memory helped the caller. */
public enum Feedback {

    POSITIVE("positive"),
    NEGATIVE("negative");

    private final String wireName;

    Feedback(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
