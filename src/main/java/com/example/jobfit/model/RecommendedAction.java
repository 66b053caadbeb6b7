package com.example.jobfit.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Remediation for a requirement gap.
 */
public enum RecommendedAction {
    /** Candidate has related skills: reword the profile to match the posting. */
    REPHRASE("rephrase", "rephrase"),
    /** Candidate likely has the skill: add proof to the profile. */
    EVIDENCE("evidence", "add evidence"),
    /** Skill is absent: acquire it. */
    LEARN("learn", "learn"),
    /** Low relevance; never part of the final gap list. */
    IGNORE("ignore", "ignore");

    private final String value;
    private final String verb;

    RecommendedAction(String value, String verb) {
        this.value = value;
        this.verb = verb;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Action verb used in the next-steps checklist. */
    public String verb() {
        return verb;
    }
}
