package com.example.jobfit.analyzer;

import com.example.jobfit.model.CandidateProfile;
import com.example.jobfit.model.CandidateSignals;
import com.example.jobfit.model.JobRequirements;
import com.example.jobfit.model.RiskLevel;
import com.example.jobfit.model.RoleFocusRisk;
import com.example.jobfit.service.AnalysisWarnings;
import com.example.jobfit.service.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Flags profiles that are broader than the posting or lean on leadership the posting does not ask for.
 * The output only ever advises narrowing the profile's focus; it never labels the candidate.
 */
@Service
public class RoleFocusRiskAssessor {

    private static final Logger log = LoggerFactory.getLogger(RoleFocusRiskAssessor.class);

    static final int MAX_REQUIREMENTS = 500;
    static final int WARNING_THRESHOLD = 200;

    /** Above this unrelated-token ratio the risk is high. */
    static final double HIGH_UNRELATED_RATIO = 0.5;
    /** From this unrelated-token ratio the risk is at least medium. */
    static final double MEDIUM_UNRELATED_RATIO = 0.3;
    static final int HIGH_MISMATCH_COUNT = 2;

    static final String NO_REQUIREMENTS = "No job requirements available; risk assessment not possible.";
    static final String PROFILE_MISSING = "Profile data is missing. Please add profile information.";

    private final TextNormalizer normalizer;
    private final CandidateSignalExtractor signalExtractor;

    public RoleFocusRiskAssessor(TextNormalizer normalizer, CandidateSignalExtractor signalExtractor) {
        this.normalizer = normalizer;
        this.signalExtractor = signalExtractor;
    }

    /**
     * @param signals pre-computed candidate signals; extracted from the profile when null
     */
    public RoleFocusRisk computeRoleFocusRisk(CandidateProfile profile, JobRequirements job, CandidateSignals signals) {
        if (profile == null) {
            return new RoleFocusRisk(RiskLevel.LOW, List.of(), List.of(PROFILE_MISSING));
        }

        JobRequirements requirements = job != null ? job : JobRequirements.empty();
        int total = requirements.matchableCount();
        if (total == 0) {
            return new RoleFocusRisk(RiskLevel.LOW, List.of(), List.of(NO_REQUIREMENTS));
        }
        if (total > MAX_REQUIREMENTS) {
            AnalysisWarnings.report("computeRoleFocusRisk", "Job requirements size (%d) exceeds limit (%d), truncated"
                    .formatted(total, MAX_REQUIREMENTS));
            requirements = truncate(requirements);
        } else if (total > WARNING_THRESHOLD) {
            AnalysisWarnings.report("computeRoleFocusRisk", "Large job requirements list (%d), processing may take longer"
                    .formatted(total));
        }

        CandidateSignals candidate = signals != null ? signals : signalExtractor.extractCandidateSignals(profile);
        Set<String> jobTokens = jobTokens(requirements);

        double unrelatedRatio = unrelatedRatio(candidate.profileTokens(), jobTokens);
        int mismatchCount = leadershipMismatch(candidate.senioritySignals(), jobTokens).size();

        RiskLevel risk = riskLevel(unrelatedRatio, mismatchCount);
        log.debug("Role focus risk {}: unrelatedRatio={}, leadershipMismatch={}", risk,
                String.format(Locale.ROOT, "%.2f", unrelatedRatio), mismatchCount);
        return new RoleFocusRisk(risk,
                reasons(unrelatedRatio, mismatchCount),
                recommendations(risk, unrelatedRatio, mismatchCount));
    }

    /** Must-haves first; nice-to-haves fill whatever room is left. */
    private static JobRequirements truncate(JobRequirements requirements) {
        List<String> mustHave = requirements.mustHave();
        List<String> keptMustHave = mustHave.subList(0, Math.min(mustHave.size(), MAX_REQUIREMENTS));
        int room = Math.max(0, MAX_REQUIREMENTS - keptMustHave.size());
        List<String> niceToHave = requirements.niceToHave();
        List<String> keptNiceToHave = niceToHave.subList(0, Math.min(niceToHave.size(), room));
        return new JobRequirements(keptMustHave, keptNiceToHave, requirements.responsibilities());
    }

    private Set<String> jobTokens(JobRequirements requirements) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String req : requirements.mustHave()) tokens.addAll(normalizer.tokenize(req));
        for (String req : requirements.niceToHave()) tokens.addAll(normalizer.tokenize(req));
        return tokens;
    }

    static double unrelatedRatio(Set<String> profileTokens, Set<String> jobTokens) {
        if (profileTokens.isEmpty()) return 0.0;
        long unrelated = profileTokens.stream().filter(t -> !jobTokens.contains(t)).count();
        return (double) unrelated / profileTokens.size();
    }

    /**
     * Seniority signals absent from the job tokens. Nothing counts as a mismatch once the job
     * itself uses any seniority vocabulary.
     */
    List<String> leadershipMismatch(Set<String> senioritySignals, Set<String> jobTokens) {
        if (signalExtractor.containsSeniorityKeyword(jobTokens)) return List.of();

        List<String> mismatched = new ArrayList<>();
        for (String signal : senioritySignals) {
            if (!jobTokens.contains(signal.toLowerCase(Locale.ROOT))) {
                mismatched.add(signal);
            }
        }
        return mismatched;
    }

    static RiskLevel riskLevel(double unrelatedRatio, int mismatchCount) {
        if (unrelatedRatio > HIGH_UNRELATED_RATIO || mismatchCount >= HIGH_MISMATCH_COUNT) return RiskLevel.HIGH;
        if (unrelatedRatio >= MEDIUM_UNRELATED_RATIO || mismatchCount >= 1) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }

    static List<String> reasons(double unrelatedRatio, int mismatchCount) {
        List<String> reasons = new ArrayList<>();
        if (unrelatedRatio > MEDIUM_UNRELATED_RATIO) {
            reasons.add("Profile contains many skills/experiences (%d%%) not mentioned in the job requirements"
                    .formatted(Math.round(unrelatedRatio * 100)));
        }
        if (mismatchCount == 1) {
            reasons.add("Leadership/strategy terms in the profile but not in the job posting");
        } else if (mismatchCount > 1) {
            reasons.add("Several leadership/strategy terms (%d) in the profile but not in the job posting"
                    .formatted(mismatchCount));
        }
        if (unrelatedRatio > HIGH_UNRELATED_RATIO) {
            reasons.add("Profile spans several domains outside the job's focus");
        }
        if (reasons.isEmpty() && unrelatedRatio >= MEDIUM_UNRELATED_RATIO) {
            reasons.add("Profile shows some deviations from the job requirements");
        }
        return reasons;
    }

    static List<String> recommendations(RiskLevel risk, double unrelatedRatio, int mismatchCount) {
        List<String> recommendations = new ArrayList<>();
        switch (risk) {
            case HIGH -> {
                if (unrelatedRatio > HIGH_UNRELATED_RATIO) {
                    recommendations.add("De-emphasize unrelated skills in the profile summary");
                    recommendations.add("Move unrelated experience to an optional section");
                }
                if (mismatchCount > 0) {
                    recommendations.add("Mention leadership/strategy experience only where relevant to the role");
                }
                recommendations.add("Focus the profile on the job requirements");
            }
            case MEDIUM -> {
                if (unrelatedRatio >= MEDIUM_UNRELATED_RATIO) {
                    recommendations.add("Move less relevant skills/experience to an optional section");
                }
                if (mismatchCount > 0) {
                    recommendations.add("Highlight leadership experience only where relevant to the role");
                }
                recommendations.add("Highlight only relevant experience");
            }
            case LOW -> recommendations.add("Profile is well focused; keep aligning with the job requirements");
        }
        return recommendations;
    }
}
