package com.example.jobfit.model;

import java.util.List;

/**
 * Top-line verdict with 2-3 explanatory bullets.
 */
public record ExecutiveSummary(
        MatchLabel matchLabel,
        List<String> bullets
) {
    public ExecutiveSummary {
        bullets = bullets != null ? List.copyOf(bullets) : List.of();
    }
}
