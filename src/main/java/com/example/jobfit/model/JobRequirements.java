package com.example.jobfit.model;

import java.util.List;

/**
 * Requirements extracted from a job posting.
 *
 * @param mustHave         Required qualifications
 * @param niceToHave       Preferred / bonus qualifications
 * @param responsibilities Tasks and responsibilities of the role
 */
public record JobRequirements(
        List<String> mustHave,
        List<String> niceToHave,
        List<String> responsibilities
) {
    public JobRequirements {
        mustHave = mustHave != null ? List.copyOf(mustHave) : List.of();
        niceToHave = niceToHave != null ? List.copyOf(niceToHave) : List.of();
        responsibilities = responsibilities != null ? List.copyOf(responsibilities) : List.of();
    }

    public static JobRequirements empty() {
        return new JobRequirements(List.of(), List.of(), List.of());
    }

    public int matchableCount() {
        return mustHave.size() + niceToHave.size();
    }
}
