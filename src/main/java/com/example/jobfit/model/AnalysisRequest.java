package com.example.jobfit.model;

/**
 * Request body of the analysis endpoints.
 *
 * @param profile        Candidate profile; null is rejected by the engine
 * @param jobPostingText Raw job posting text
 */
public record AnalysisRequest(
        CandidateProfile profile,
        String jobPostingText
) {}
