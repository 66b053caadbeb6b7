package com.example.jobfit.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Structured CV data supplied by the caller. Read-only to the analysis pipeline.
 * <p>
 * Missing text fields are normalized to the empty string and missing lists to empty lists,
 * so the pipeline stages never have to null-check individual fields.
 *
 * @param summary     Optional profile summary
 * @param experiences Work experience entries
 * @param education   Education entries
 * @param skills      Free-text skills list
 * @param projects    Optional projects / responsibilities text
 */
public record CandidateProfile(
        String summary,
        List<ExperienceEntry> experiences,
        List<EducationEntry> education,
        String skills,
        String projects
) {
    public CandidateProfile {
        summary = summary != null ? summary : "";
        experiences = experiences != null
                ? experiences.stream().filter(Objects::nonNull).toList()
                : List.of();
        education = education != null
                ? education.stream().filter(Objects::nonNull).toList()
                : List.of();
        skills = skills != null ? skills : "";
        projects = projects != null ? projects : "";
    }

    /**
     * Skills, summary, projects and every experience's role + description, joined by spaces.
     * This is the text scanned for coverage and seniority signals.
     */
    public String allText() {
        return Stream.concat(
                Stream.of(skills, summary, projects),
                experiences.stream().map(ExperienceEntry::text)
        ).collect(Collectors.joining(" "));
    }

    public CandidateProfile withSummary(String newSummary) {
        return new CandidateProfile(newSummary, experiences, education, skills, projects);
    }

    public CandidateProfile withSkills(String newSkills) {
        return new CandidateProfile(summary, experiences, education, newSkills, projects);
    }

    public CandidateProfile withProjects(String newProjects) {
        return new CandidateProfile(summary, experiences, education, skills, newProjects);
    }

    public CandidateProfile withExperiences(List<ExperienceEntry> newExperiences) {
        return new CandidateProfile(summary, newExperiences, education, skills, projects);
    }

    public CandidateProfile withEducation(List<EducationEntry> newEducation) {
        return new CandidateProfile(summary, experiences, newEducation, skills, projects);
    }
}
