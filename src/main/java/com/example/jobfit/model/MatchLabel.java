package com.example.jobfit.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse verdict of the executive summary.
 */
public enum MatchLabel {
    GOOD_FIT("good fit", "Good fit"),
    PARTIAL_FIT("partial fit", "Partial fit"),
    STRETCH_ROLE("stretch role", "Stretch role");

    private final String value;
    private final String displayName;

    MatchLabel(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Capitalized form used at the start of summary bullets. */
    public String displayName() {
        return displayName;
    }
}
