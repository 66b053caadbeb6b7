package com.example.jobfit.model;

import java.util.List;

/**
 * ATS formatting / coverage assessment.
 *
 * @param score     Weighted overall score (0-100)
 * @param breakdown Sub-scores
 * @param todos     Improvement suggestions, most urgent first
 */
public record AtsAnalysis(
        int score,
        AtsBreakdown breakdown,
        List<String> todos
) {
    public AtsAnalysis {
        todos = todos != null ? List.copyOf(todos) : List.of();
    }
}
