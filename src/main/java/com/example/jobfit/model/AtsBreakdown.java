package com.example.jobfit.model;

/**
 * The four ATS sub-scores, each 0-100.
 */
public record AtsBreakdown(
        int structure,
        int coverage,
        int placement,
        int context
) {
    public AtsBreakdown {
        structure = clamp(structure);
        coverage = clamp(coverage);
        placement = clamp(placement);
        context = clamp(context);
    }

    public static AtsBreakdown zero() {
        return new AtsBreakdown(0, 0, 0, 0);
    }

    private static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }
}
