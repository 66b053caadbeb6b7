package com.example.jobfit.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchStatus {
    MET("met"),
    PARTIAL("partial"),
    MISSING("missing");

    private final String value;

    MatchStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
