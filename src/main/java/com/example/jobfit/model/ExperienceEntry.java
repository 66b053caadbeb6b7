package com.example.jobfit.model;

/**
 * A single work experience entry of a candidate profile.
 *
 * @param employer    Employer name
 * @param role        Job title held at the employer
 * @param startDate   Start date, usually MM/YYYY
 * @param endDate     End date (MM/YYYY) or "current"
 * @param description Free-text description, optionally bullet-formatted
 */
public record ExperienceEntry(
        String employer,
        String role,
        String startDate,
        String endDate,
        String description
) {
    public ExperienceEntry {
        employer = employer != null ? employer : "";
        role = role != null ? role : "";
        startDate = startDate != null ? startDate : "";
        endDate = endDate != null ? endDate : "";
        description = description != null ? description : "";
    }

    /** Role and description joined, the text an ATS associates with this entry. */
    public String text() {
        return role + " " + description;
    }

    public ExperienceEntry withRole(String newRole) {
        return new ExperienceEntry(employer, newRole, startDate, endDate, description);
    }

    public ExperienceEntry withDescription(String newDescription) {
        return new ExperienceEntry(employer, role, startDate, endDate, newDescription);
    }
}
