package com.example.jobfit.model;

import java.util.List;

/**
 * Breadth / leadership mismatch signal of a profile relative to a posting.
 */
public record RoleFocusRisk(
        RiskLevel risk,
        List<String> reasons,
        List<String> recommendations
) {
    public RoleFocusRisk {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }
}
