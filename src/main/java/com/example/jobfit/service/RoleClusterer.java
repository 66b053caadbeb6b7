package com.example.jobfit.service;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps a job posting to coarse, anonymous categories for usage statistics:
 * a role cluster, an industry cluster and an ATS score bucket.
 * Keyword tables are checked in declaration order; the first hit wins.
 */
@Component
public class RoleClusterer {

    public static final String DEFAULT_ROLE = "Other";
    public static final String DEFAULT_INDUSTRY = "Unknown";

    /** The role title is expected near the top of the posting. */
    private static final int ROLE_SCAN_LENGTH = 500;

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}_\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<String, String> ROLE_KEYWORDS = keywordTable(
            "software engineer", "Software Engineer",
            "software developer", "Software Engineer",
            "entwickler", "Software Engineer",
            "programmierer", "Software Engineer",
            "full stack", "Software Engineer",
            "fullstack", "Software Engineer",
            "backend", "Software Engineer",
            "frontend", "Software Engineer",
            "full-stack", "Software Engineer",

            "data scientist", "Data Scientist",
            "data analyst", "Data Scientist",
            "data engineer", "Data Scientist",
            "data science", "Data Scientist",
            "machine learning", "Data Scientist",
            "ml engineer", "Data Scientist",
            "ai engineer", "Data Scientist",

            "product manager", "Product Manager",
            "produktmanager", "Product Manager",
            "product owner", "Product Manager",
            "po ", "Product Manager",
            "scrum master", "Product Manager",

            "designer", "Designer",
            "ux designer", "Designer",
            "ui designer", "Designer",
            "ux/ui", "Designer",
            "product designer", "Designer",

            "devops", "DevOps Engineer",
            "sre", "DevOps Engineer",
            "site reliability", "DevOps Engineer",
            "cloud engineer", "DevOps Engineer",
            "infrastructure", "DevOps Engineer",

            "qa engineer", "QA Engineer",
            "test engineer", "QA Engineer",
            "quality assurance", "QA Engineer",
            "tester", "QA Engineer"
    );

    // Finance before Technology so that "fintech" is not claimed by "tech".
    private static final Map<String, String> INDUSTRY_KEYWORDS = keywordTable(
            "fintech", "Finance",
            "finance", "Finance",
            "banking", "Finance",
            "financial", "Finance",

            "healthcare", "Healthcare",
            "health", "Healthcare",
            "medical", "Healthcare",
            "pharma", "Healthcare",

            "e-commerce", "E-commerce",
            "ecommerce", "E-commerce",
            "retail", "E-commerce",
            "online shop", "E-commerce",

            "software", "Technology",
            "information technology", "Technology",
            "it ", "Technology",
            "saas", "Technology",
            "tech", "Technology"
    );

    public String roleCluster(String jobPostingText) {
        if (jobPostingText == null || jobPostingText.isBlank()) return DEFAULT_ROLE;
        String head = jobPostingText.substring(0, Math.min(ROLE_SCAN_LENGTH, jobPostingText.length()));
        return firstHit(normalize(head), ROLE_KEYWORDS, DEFAULT_ROLE);
    }

    public String industryCluster(String jobPostingText) {
        if (jobPostingText == null || jobPostingText.isBlank()) return DEFAULT_INDUSTRY;
        return firstHit(normalize(jobPostingText), INDUSTRY_KEYWORDS, DEFAULT_INDUSTRY);
    }

    public static String atsScoreBucket(int atsScore) {
        if (atsScore >= 0 && atsScore <= 20) return "very_low";
        if (atsScore >= 21 && atsScore <= 40) return "low";
        if (atsScore >= 41 && atsScore <= 60) return "medium";
        if (atsScore >= 61 && atsScore <= 80) return "high";
        if (atsScore >= 81 && atsScore <= 100) return "very_high";
        return "unknown";
    }

    private static String firstHit(String text, Map<String, String> keywords, String fallback) {
        for (Map.Entry<String, String> entry : keywords.entrySet()) {
            if (text.contains(entry.getKey())) return entry.getValue();
        }
        return fallback;
    }

    /**
     * Lowercase, punctuation to spaces, whitespace collapsed. Trailing spaces are kept so that
     * keywords such as "po " still need a word boundary.
     */
    private static String normalize(String text) {
        String cleaned = PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return WHITESPACE.matcher(cleaned).replaceAll(" ");
    }

    /** Keywords go through the same normalization as the text they are matched against. */
    private static Map<String, String> keywordTable(String... pairs) {
        Map<String, String> table = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            table.putIfAbsent(normalize(pairs[i]), pairs[i + 1]);
        }
        return table;
    }
}
