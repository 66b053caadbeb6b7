package com.example.jobfit.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Relevance of a requirement verdict. Declaration order is the priority order (HIGH first).
 */
public enum Relevance {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    Relevance(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
