package com.example.jobfit.model;

import java.util.List;

/**
 * Full output of one analysis run. Immutable; instances are shared through the result cache.
 */
public record AnalysisResult(
        ExecutiveSummary summary,
        SkillFit skillFit,
        List<GapActionCard> gaps,
        AtsAnalysis ats,
        RoleFocusRisk roleFocus,
        List<String> nextSteps
) {
    public AnalysisResult {
        gaps = gaps != null ? List.copyOf(gaps) : List.of();
        nextSteps = nextSteps != null ? List.copyOf(nextSteps) : List.of();
    }
}
