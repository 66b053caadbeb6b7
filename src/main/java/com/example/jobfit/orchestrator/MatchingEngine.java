package com.example.jobfit.orchestrator;

import com.example.jobfit.analyzer.AtsScoreCalculator;
import com.example.jobfit.analyzer.CandidateSignalExtractor;
import com.example.jobfit.analyzer.GapIdentifier;
import com.example.jobfit.analyzer.JobRequirementExtractor;
import com.example.jobfit.analyzer.RequirementMatcher;
import com.example.jobfit.analyzer.RoleFocusRiskAssessor;
import com.example.jobfit.analyzer.SummaryBuilder;
import com.example.jobfit.model.*;
import com.example.jobfit.service.InputLimits;
import com.example.jobfit.service.ResultCache;
import com.example.jobfit.service.UsageStatisticsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fit analysis pipeline.
 * Pipeline:
 * 1. Job requirement extraction
 * 2. Candidate signal extraction
 * 3. Requirement matching (must-have and nice-to-have)
 * 4. ATS scoring
 * 5. Role focus risk
 * 6. Gap identification
 * 7. Executive summary
 * 8. Next steps
 * <p>
 * Results are cached by content hash; identical inputs return the cached instance.
 * Usage statistics are recorded in the background for cache misses only.
 */
@Service
public class MatchingEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchingEngine.class);

    private final InputLimits inputLimits;
    private final JobRequirementExtractor requirementExtractor;
    private final CandidateSignalExtractor signalExtractor;
    private final RequirementMatcher requirementMatcher;
    private final AtsScoreCalculator atsScoreCalculator;
    private final RoleFocusRiskAssessor roleFocusRiskAssessor;
    private final GapIdentifier gapIdentifier;
    private final SummaryBuilder summaryBuilder;
    private final ResultCache resultCache;
    private final UsageStatisticsService statisticsService;
    private final ExecutorService statisticsExecutor;

    public MatchingEngine(InputLimits inputLimits,
                          JobRequirementExtractor requirementExtractor,
                          CandidateSignalExtractor signalExtractor,
                          RequirementMatcher requirementMatcher,
                          AtsScoreCalculator atsScoreCalculator,
                          RoleFocusRiskAssessor roleFocusRiskAssessor,
                          GapIdentifier gapIdentifier,
                          SummaryBuilder summaryBuilder,
                          ResultCache resultCache,
                          UsageStatisticsService statisticsService,
                          ExecutorService statisticsExecutor) {
        this.inputLimits = inputLimits;
        this.requirementExtractor = requirementExtractor;
        this.signalExtractor = signalExtractor;
        this.requirementMatcher = requirementMatcher;
        this.atsScoreCalculator = atsScoreCalculator;
        this.roleFocusRiskAssessor = roleFocusRiskAssessor;
        this.gapIdentifier = gapIdentifier;
        this.summaryBuilder = summaryBuilder;
        this.resultCache = resultCache;
        this.statisticsService = statisticsService;
        this.statisticsExecutor = statisticsExecutor;
    }

    /**
     * Runs the full analysis for one profile / posting pair.
     *
     * @throws InvalidInputException if the profile is null or the posting is blank
     */
    public AnalysisResult runAnalysis(CandidateProfile profile, String jobPostingText) {
        if (profile == null) {
            throw new InvalidInputException("Profile data is required");
        }
        if (jobPostingText == null || jobPostingText.isBlank()) {
            throw new InvalidInputException("Job posting text is required");
        }

        String cacheKey = ResultCache.key(profile, jobPostingText);
        AnalysisResult cached = resultCache.get(cacheKey);
        if (cached != null) {
            log.info("Cache hit for analysis {}", cacheKey);
            return cached;
        }

        log.info("Starting fit analysis {} ({} posting characters, {} experience entries)",
                cacheKey, jobPostingText.length(), profile.experiences().size());

        String jobText = inputLimits.limitJobText(jobPostingText);
        CandidateProfile limitedProfile = inputLimits.limitProfile(profile);

        // ── Step 1: Job requirements ──
        JobRequirements requirements = requirementExtractor.parseJobRequirements(jobText);
        log.info("[1/8] Requirements extracted: {} must-have, {} nice-to-have, {} responsibilities",
                requirements.mustHave().size(), requirements.niceToHave().size(),
                requirements.responsibilities().size());

        // ── Step 2: Candidate signals ──
        CandidateSignals signals = signalExtractor.extractCandidateSignals(limitedProfile);
        log.info("[2/8] Candidate signals: {} skill tokens, {} experience tokens, {} seniority signals",
                signals.skillsTokens().size(), signals.experienceTokens().size(),
                signals.senioritySignals().size());

        // ── Step 3: Requirement matching ──
        List<RequirementMatch> mustHave = requirementMatcher.matchRequirements(requirements.mustHave(), signals);
        List<RequirementMatch> niceToHave = requirementMatcher.matchRequirements(requirements.niceToHave(), signals);
        SkillFit skillFit = new SkillFit(mustHave, niceToHave);
        log.info("[3/8] Matching completed: {}/{} must-have met, {}/{} nice-to-have met",
                countMet(mustHave), mustHave.size(), countMet(niceToHave), niceToHave.size());

        // ── Step 4: ATS score ──
        AtsAnalysis ats = atsScoreCalculator.computeAtsScore(limitedProfile, requirements.mustHave());
        log.info("[4/8] ATS score: {}/100 ({} todos)", ats.score(), ats.todos().size());

        // ── Step 5: Role focus risk ──
        RoleFocusRisk roleFocus = roleFocusRiskAssessor.computeRoleFocusRisk(limitedProfile, requirements, signals);
        log.info("[5/8] Role focus risk: {}", roleFocus.risk().value());

        // ── Step 6: Gaps (must-have only) ──
        List<GapActionCard> gaps = gapIdentifier.identifyGaps(mustHave, signals);
        log.info("[6/8] {} actionable gaps", gaps.size());

        // ── Step 7: Executive summary ──
        ExecutiveSummary summary = summaryBuilder.buildExecutiveSummary(skillFit, gaps, roleFocus, ats);
        log.info("[7/8] Match label: {}", summary.matchLabel().value());

        // ── Step 8: Next steps ──
        List<String> nextSteps = summaryBuilder.buildNextSteps(ats.todos(), gaps, roleFocus.recommendations());
        log.info("[8/8] {} next steps", nextSteps.size());

        AnalysisResult result = new AnalysisResult(summary, skillFit, gaps, ats, roleFocus, nextSteps);
        resultCache.put(cacheKey, result);
        recordStatistics(result, jobText);
        return result;
    }

    /**
     * Fire-and-forget: statistics failures are logged and never reach the caller.
     */
    private void recordStatistics(AnalysisResult result, String jobText) {
        if (!statisticsService.isEnabled()) return;
        try {
            statisticsExecutor.execute(() -> {
                try {
                    statisticsService.trackAnalysis(result, jobText);
                } catch (RuntimeException e) {
                    log.warn("Failed to track statistics: {}", e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Statistics update skipped: {}", e.getMessage());
        }
    }

    private static long countMet(List<RequirementMatch> matches) {
        return matches.stream().filter(m -> m.status() == MatchStatus.MET).count();
    }
}
