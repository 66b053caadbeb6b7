package com.example.jobfit.orchestrator;

/**
 * Thrown when an analysis cannot start: the profile is missing or the job posting is blank.
 * Not retryable; the caller has to fix the input.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
