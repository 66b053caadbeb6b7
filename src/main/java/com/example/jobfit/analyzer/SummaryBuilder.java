package com.example.jobfit.analyzer;

import com.example.jobfit.model.AtsAnalysis;
import com.example.jobfit.model.ExecutiveSummary;
import com.example.jobfit.model.GapActionCard;
import com.example.jobfit.model.MatchLabel;
import com.example.jobfit.model.MatchStatus;
import com.example.jobfit.model.Relevance;
import com.example.jobfit.model.RiskLevel;
import com.example.jobfit.model.RoleFocusRisk;
import com.example.jobfit.model.SkillFit;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Condenses the stage results into the executive summary and the next-steps checklist.
 */
@Service
public class SummaryBuilder {

    static final double STRETCH_MET_RATIO = 0.3;
    static final double GOOD_FIT_MET_RATIO = 0.7;
    static final int STRETCH_ATS_SCORE = 40;
    static final int GOOD_FIT_ATS_SCORE = 60;
    static final int STRETCH_HIGH_GAPS = 3;
    static final int GOOD_FIT_MAX_MISSING = 2;

    /** ATS scores below this are called out as needing work. */
    static final int ATS_CALLOUT_LOW = 60;
    /** ATS scores from this value up are called out as very good. */
    static final int ATS_CALLOUT_HIGH = 80;
    /** ATS todos are only surfaced in the summary below this score. */
    static final int ATS_TODO_SCORE = 70;

    static final int MIN_BULLETS = 2;
    static final int MAX_BULLETS = 3;

    private static final String STRETCH_PADDING = "Substantial profile adjustments are needed";
    static final String NO_SKILL_FIT = "No skill fit data available. Please run the analysis again.";

    public ExecutiveSummary buildExecutiveSummary(SkillFit skillFit, List<GapActionCard> gaps,
                                                  RoleFocusRisk roleFocus, AtsAnalysis ats) {
        if (skillFit == null) {
            return new ExecutiveSummary(MatchLabel.STRETCH_ROLE, List.of(NO_SKILL_FIT, STRETCH_PADDING));
        }
        List<GapActionCard> gapList = gaps != null ? gaps : List.of();

        int mustHaveCount = skillFit.mustHave().size();
        int metCount = (int) skillFit.mustHave().stream()
                .filter(m -> m.status() == MatchStatus.MET)
                .count();

        MatchLabel label = matchLabel(mustHaveCount, metCount, gapList, roleFocus, ats);
        return new ExecutiveSummary(label, bullets(label, mustHaveCount, metCount, gapList, roleFocus, ats));
    }

    static MatchLabel matchLabel(int mustHaveCount, int metCount, List<GapActionCard> gaps,
                                 RoleFocusRisk roleFocus, AtsAnalysis ats) {
        double metRatio = mustHaveCount > 0 ? (double) metCount / mustHaveCount : 0.0;
        long missing = gaps.stream().filter(g -> g.status() == MatchStatus.MISSING).count();
        long highMissing = highRelevanceMissing(gaps).size();

        if (metRatio < STRETCH_MET_RATIO
                || ats.score() < STRETCH_ATS_SCORE
                || roleFocus.risk() == RiskLevel.HIGH
                || highMissing >= STRETCH_HIGH_GAPS) {
            return MatchLabel.STRETCH_ROLE;
        }
        if (metRatio >= GOOD_FIT_MET_RATIO
                && ats.score() >= GOOD_FIT_ATS_SCORE
                && roleFocus.risk() != RiskLevel.HIGH
                && missing <= GOOD_FIT_MAX_MISSING) {
            return MatchLabel.GOOD_FIT;
        }
        return MatchLabel.PARTIAL_FIT;
    }

    private static List<String> bullets(MatchLabel label, int mustHaveCount, int metCount,
                                        List<GapActionCard> gaps, RoleFocusRisk roleFocus, AtsAnalysis ats) {
        List<String> bullets = new ArrayList<>();

        String ratio = "%s: %d of %d must-have requirements met".formatted(label.displayName(), metCount, mustHaveCount);
        bullets.add(switch (label) {
            case GOOD_FIT -> ratio;
            case PARTIAL_FIT -> ratio + ", some gaps remain";
            case STRETCH_ROLE -> ratio + ", several important gaps";
        });

        if (roleFocus.risk() == RiskLevel.HIGH) {
            bullets.add("Role focus risk: " + roleFocus.risk().value());
        } else if (ats.score() < ATS_CALLOUT_LOW) {
            bullets.add("ATS score: %d/100 (optimization recommended)".formatted(ats.score()));
        } else if (ats.score() >= ATS_CALLOUT_HIGH) {
            bullets.add("ATS score: %d/100 (very good)".formatted(ats.score()));
        }

        List<String> keyGaps = highRelevanceMissing(gaps).stream()
                .limit(3)
                .map(GapActionCard::requirement)
                .toList();
        if (!keyGaps.isEmpty()) {
            String text = keyGaps.size() == 1
                    ? keyGaps.get(0)
                    : String.join(", ", keyGaps.subList(0, 2)) + (keyGaps.size() > 2 ? " and more" : "");
            bullets.add("Key gaps: " + text);
        } else if (!roleFocus.recommendations().isEmpty() && roleFocus.risk() != RiskLevel.LOW) {
            bullets.add("Recommendation: " + roleFocus.recommendations().get(0));
        } else if (!ats.todos().isEmpty() && ats.score() < ATS_TODO_SCORE) {
            bullets.add("ATS optimization: " + ats.todos().get(0));
        }

        if (bullets.size() < MIN_BULLETS) {
            bullets.add(switch (label) {
                case GOOD_FIT -> "Profile aligns well with the job requirements";
                case PARTIAL_FIT -> "A few profile adjustments could improve the fit";
                case STRETCH_ROLE -> STRETCH_PADDING;
            });
        }
        return bullets.size() > MAX_BULLETS ? bullets.subList(0, MAX_BULLETS) : bullets;
    }

    /**
     * Role-focus recommendations, then ATS todos, then gaps ordered high, medium, low relevance.
     * Gaps of equal relevance keep their input order.
     */
    public List<String> buildNextSteps(List<String> atsTodos, List<GapActionCard> gaps, List<String> roleFocusRecommendations) {
        List<String> steps = new ArrayList<>();
        if (roleFocusRecommendations != null) {
            roleFocusRecommendations.forEach(rec -> steps.add("Role focus: " + rec));
        }
        if (atsTodos != null) {
            atsTodos.forEach(todo -> steps.add("ATS: " + todo));
        }
        if (gaps != null) {
            gaps.stream()
                    .sorted(Comparator.comparing(GapActionCard::relevance))
                    .forEach(gap -> steps.add("Gap: %s - %s".formatted(gap.requirement(), gap.recommendedAction().verb())));
        }
        return steps;
    }

    private static List<GapActionCard> highRelevanceMissing(List<GapActionCard> gaps) {
        return gaps.stream()
                .filter(g -> g.relevance() == Relevance.HIGH && g.status() == MatchStatus.MISSING)
                .toList();
    }
}
