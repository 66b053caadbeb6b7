package com.example.jobfit.model;

/**
 * Soft signal raised when an input is oversized. Processing continues after truncation.
 *
 * @param source  Pipeline operation that raised the warning
 * @param message Human-readable description
 */
public record PerformanceWarning(
        String source,
        String message
) {}
