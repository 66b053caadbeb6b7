package com.example.jobfit.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One remediation item derived from a partial or missing requirement.
 *
 * @param requirement       Requirement text
 * @param relevance         Relevance of the underlying match
 * @param status            partial / missing
 * @param recommendedAction rephrase / evidence / learn (ignore never leaves the gap identifier)
 * @param suggestionType    "synonym_match", "partial_match" or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GapActionCard(
        String requirement,
        Relevance relevance,
        MatchStatus status,
        RecommendedAction recommendedAction,
        String suggestionType
) {
    public static final String SYNONYM_MATCH = "synonym_match";
    public static final String PARTIAL_MATCH = "partial_match";
}
