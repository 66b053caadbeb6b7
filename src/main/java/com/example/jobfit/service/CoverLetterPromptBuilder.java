package com.example.jobfit.service;

import com.example.jobfit.model.AnalysisResult;
import com.example.jobfit.model.MatchStatus;
import com.example.jobfit.model.Relevance;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds a compact, copy-ready prompt for drafting a cover letter with an external assistant.
 * Contains the role title, curated strengths and gaps only: never the full CV or posting.
 */
@Component
public class CoverLetterPromptBuilder {

    static final String DEFAULT_ROLE_TITLE = "Job posting";
    static final String NO_RESULT = "No analysis result available.";

    private static final int MAX_TITLE_LENGTH = 100;
    private static final int MAX_STRENGTHS = 5;
    private static final int MAX_GAPS = 2;

    private static final List<String> NEGATIVE_INDICATORS = List.of(
            "keine führung", "keine leadership", "keine strategie",
            "no leadership", "no strategy", "nicht erforderlich", "not required"
    );

    private static final List<String> LEADERSHIP_TERMS = List.of(
            "leadership", "führung", "führen", "teamleitung", "team lead", "manager",
            "management", "strategie", "strategy", "strategisch", "strategic", "leitend", "leading"
    );

    public String build(AnalysisResult result, String jobPostingText) {
        if (result == null) return NO_RESULT;

        List<String> strengths = result.skillFit().mustHave().stream()
                .filter(m -> m.status() == MatchStatus.MET)
                .limit(MAX_STRENGTHS)
                .map(m -> "- " + m.requirement()
                        + (m.evidence() != null && !m.evidence().isEmpty() ? " (" + m.evidence() + ")" : ""))
                .toList();

        List<String> gaps = result.gaps().stream()
                .filter(g -> g.status() == MatchStatus.MISSING && g.relevance() == Relevance.HIGH)
                .limit(MAX_GAPS)
                .map(g -> "- " + g.requirement())
                .toList();

        List<String> lines = new ArrayList<>();
        lines.add("**Role:** " + roleTitle(jobPostingText));
        lines.add("");

        if (!strengths.isEmpty()) {
            lines.add("**Strengths (top matches):**");
            lines.addAll(strengths);
            lines.add("");
        }

        if (!gaps.isEmpty()) {
            lines.add("**Key gaps (address carefully):**");
            lines.addAll(gaps);
            lines.add("");
        }

        lines.add("**Cover letter guidance:**");
        lines.add("- Professional, precise tone");
        lines.add("- Do not mention salary expectations");
        lines.add("- Do not claim skills that are not listed");
        if (!asksForLeadershipOrStrategy(jobPostingText)) {
            lines.add("- Do not mention leadership or strategy experience (not in the requirements)");
        }

        lines.add("");
        lines.add("**Please write a cover letter based on this information.**");
        return String.join("\n", lines);
    }

    /** First non-empty line of the posting, shortened to 100 characters. */
    static String roleTitle(String jobPostingText) {
        if (jobPostingText == null || jobPostingText.isBlank()) return DEFAULT_ROLE_TITLE;

        String firstLine = jobPostingText.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .findFirst()
                .orElse(DEFAULT_ROLE_TITLE);
        return firstLine.length() > MAX_TITLE_LENGTH
                ? firstLine.substring(0, MAX_TITLE_LENGTH - 3) + "..."
                : firstLine;
    }

    /**
     * True when the posting mentions leadership or strategy, unless it explicitly negates it
     * ("no leadership", "nicht erforderlich", ...).
     */
    static boolean asksForLeadershipOrStrategy(String jobPostingText) {
        if (jobPostingText == null || jobPostingText.isBlank()) return false;

        String text = jobPostingText.toLowerCase(Locale.ROOT);
        if (NEGATIVE_INDICATORS.stream().anyMatch(text::contains)) return false;
        return LEADERSHIP_TERMS.stream().anyMatch(text::contains);
    }
}
