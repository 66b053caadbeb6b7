package com.example.jobfit.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Normalized evidence extracted from a candidate profile.
 * Sets keep insertion order so that derived output stays deterministic.
 *
 * @param skillsTokens     Tokens from the skills text
 * @param experienceTokens Tokens from experience entries, summary and projects
 * @param senioritySignals Leadership / seniority signals (keywords, years, role phrases)
 */
public record CandidateSignals(
        Set<String> skillsTokens,
        Set<String> experienceTokens,
        Set<String> senioritySignals
) {
    public CandidateSignals {
        skillsTokens = freeze(skillsTokens);
        experienceTokens = freeze(experienceTokens);
        senioritySignals = freeze(senioritySignals);
    }

    public static CandidateSignals empty() {
        return new CandidateSignals(Set.of(), Set.of(), Set.of());
    }

    /** Skills and experience tokens, without seniority signals. */
    public Set<String> profileTokens() {
        Set<String> all = new LinkedHashSet<>(skillsTokens);
        all.addAll(experienceTokens);
        return all;
    }

    /** Every token and signal, used for requirement lookups. */
    public Set<String> allTokens() {
        Set<String> all = profileTokens();
        all.addAll(senioritySignals);
        return all;
    }

    private static Set<String> freeze(Set<String> values) {
        return values != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(values))
                : Set.of();
    }
}
