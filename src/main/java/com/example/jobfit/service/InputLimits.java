package com.example.jobfit.service;

import com.example.jobfit.model.CandidateProfile;
import com.example.jobfit.model.EducationEntry;
import com.example.jobfit.model.ExperienceEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Size caps applied to both inputs before the pipeline runs.
 * Oversized input is truncated, never rejected, and each truncation raises a performance warning.
 */
@Component
public class InputLimits {

    public static final int MAX_JOB_TEXT_LENGTH = 100_000;
    public static final int MAX_PROFILE_TEXT_LENGTH = 40_000;

    private static final String SOURCE = "inputLimits";

    public String limitJobText(String jobPostingText) {
        if (jobPostingText == null || jobPostingText.length() <= MAX_JOB_TEXT_LENGTH) {
            return jobPostingText;
        }
        AnalysisWarnings.report(SOURCE, "Job posting truncated from %d to %d characters"
                .formatted(jobPostingText.length(), MAX_JOB_TEXT_LENGTH));
        return jobPostingText.substring(0, MAX_JOB_TEXT_LENGTH);
    }

    /**
     * Total characters over summary, skills, projects, every experience role and description
     * and every education note.
     */
    public static int profileTextLength(CandidateProfile profile) {
        int total = profile.summary().length() + profile.skills().length() + profile.projects().length();
        for (ExperienceEntry experience : profile.experiences()) {
            total += experience.role().length() + experience.description().length();
        }
        for (EducationEntry education : profile.education()) {
            total += education.notes().length();
        }
        return total;
    }

    /**
     * Spends the character budget in the order summary, skills, projects, experiences
     * (role, then description) and education notes. Fields past the budget are emptied.
     */
    public CandidateProfile limitProfile(CandidateProfile profile) {
        int total = profileTextLength(profile);
        if (total <= MAX_PROFILE_TEXT_LENGTH) return profile;

        AnalysisWarnings.report(SOURCE, "Profile text truncated from %d to %d characters"
                .formatted(total, MAX_PROFILE_TEXT_LENGTH));

        Budget budget = new Budget(MAX_PROFILE_TEXT_LENGTH);
        String summary = budget.take(profile.summary());
        String skills = budget.take(profile.skills());
        String projects = budget.take(profile.projects());

        List<ExperienceEntry> experiences = new ArrayList<>(profile.experiences().size());
        for (ExperienceEntry experience : profile.experiences()) {
            String role = budget.take(experience.role());
            String description = budget.take(experience.description());
            experiences.add(experience.withRole(role).withDescription(description));
        }

        List<EducationEntry> education = new ArrayList<>(profile.education().size());
        for (EducationEntry entry : profile.education()) {
            education.add(entry.withNotes(budget.take(entry.notes())));
        }

        return profile.withSummary(summary)
                .withSkills(skills)
                .withProjects(projects)
                .withExperiences(experiences)
                .withEducation(education);
    }

    private static final class Budget {
        private int remaining;

        Budget(int remaining) {
            this.remaining = remaining;
        }

        String take(String text) {
            if (text.length() <= remaining) {
                remaining -= text.length();
                return text;
            }
            String head = text.substring(0, remaining);
            remaining = 0;
            return head;
        }
    }
}
