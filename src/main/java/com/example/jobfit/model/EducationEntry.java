package com.example.jobfit.model;

/**
 * Education entry of a candidate profile. All fields are optional.
 */
public record EducationEntry(
        String degree,
        String institution,
        String startDate,
        String endDate,
        String notes
) {
    public EducationEntry {
        degree = degree != null ? degree : "";
        institution = institution != null ? institution : "";
        startDate = startDate != null ? startDate : "";
        endDate = endDate != null ? endDate : "";
        notes = notes != null ? notes : "";
    }

    public EducationEntry withNotes(String newNotes) {
        return new EducationEntry(degree, institution, startDate, endDate, newNotes);
    }
}
