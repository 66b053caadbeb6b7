package com.example.jobfit.model;

/**
 * Verdict for a single job requirement.
 *
 * @param requirement Requirement text exactly as extracted from the posting
 * @param status      met / partial / missing
 * @param similarity  Match strength (0.0-1.0)
 * @param relevance   high / medium / low
 * @param evidence    Short human-readable explanation of what matched
 */
public record RequirementMatch(
        String requirement,
        MatchStatus status,
        double similarity,
        Relevance relevance,
        String evidence
) {
    public RequirementMatch {
        similarity = Math.max(0.0, Math.min(1.0, similarity));
    }

    public static RequirementMatch missing(String requirement, String evidence) {
        return new RequirementMatch(requirement, MatchStatus.MISSING, 0.0, Relevance.LOW, evidence);
    }
}
