package com.example.jobfit.model;

import java.util.List;

public record SkillFit(
        List<RequirementMatch> mustHave,
        List<RequirementMatch> niceToHave
) {
    public SkillFit {
        mustHave = mustHave != null ? List.copyOf(mustHave) : List.of();
        niceToHave = niceToHave != null ? List.copyOf(niceToHave) : List.of();
    }
}
