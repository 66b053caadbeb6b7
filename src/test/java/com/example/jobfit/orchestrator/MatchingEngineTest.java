package com.example.jobfit.orchestrator;

import com.example.jobfit.analyzer.AtsScoreCalculator;
import com.example.jobfit.analyzer.CandidateSignalExtractor;
import com.example.jobfit.analyzer.GapIdentifier;
import com.example.jobfit.analyzer.JobRequirementExtractor;
import com.example.jobfit.analyzer.RequirementMatcher;
import com.example.jobfit.analyzer.RoleFocusRiskAssessor;
import com.example.jobfit.analyzer.SummaryBuilder;
import com.example.jobfit.model.AnalysisResult;
import com.example.jobfit.model.CandidateProfile;
import com.example.jobfit.model.ExperienceEntry;
import com.example.jobfit.model.MatchStatus;
import com.example.jobfit.model.RequirementMatch;
import com.example.jobfit.service.AnalysisWarnings;
import com.example.jobfit.service.InputLimits;
import com.example.jobfit.service.ResultCache;
import com.example.jobfit.service.SynonymIndex;
import com.example.jobfit.service.TextNormalizer;
import com.example.jobfit.service.UsageStatisticsService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class MatchingEngineTest {

    private static final String POSTING = """
            Frontend Developer

            Requirements:
            - TypeScript
            - React
            - GraphQL

            Nice to have:
            - Docker
            """;

    private static final CandidateProfile PROFILE = new CandidateProfile(
            "Frontend developer with a focus on design systems",
            List.of(new ExperienceEntry("Acme", "Frontend Developer", "01/2020", "current",
                    "- Built React components in TypeScript\n- Reduced bundle size by 30%")),
            List.of(),
            "TypeScript, React, Node.js",
            null);

    private UsageStatisticsService statistics;
    private ExecutorService executor;
    private ResultCache cache;
    private MatchingEngine engine;

    @BeforeEach
    void setUp() {
        statistics = mock(UsageStatisticsService.class);
        when(statistics.isEnabled()).thenReturn(true);

        executor = mock(ExecutorService.class);
        doAnswer(invocation -> {
            invocation.<Runnable>getArgument(0).run();
            return null;
        }).when(executor).execute(any(Runnable.class));

        cache = new ResultCache(10);

        TextNormalizer normalizer = new TextNormalizer();
        SynonymIndex synonyms = new SynonymIndex();
        CandidateSignalExtractor signalExtractor = new CandidateSignalExtractor(normalizer);
        engine = new MatchingEngine(
                new InputLimits(),
                new JobRequirementExtractor(normalizer),
                signalExtractor,
                new RequirementMatcher(normalizer, synonyms),
                new AtsScoreCalculator(normalizer),
                new RoleFocusRiskAssessor(normalizer, signalExtractor),
                new GapIdentifier(normalizer, synonyms),
                new SummaryBuilder(),
                cache,
                statistics,
                executor);
    }

    @AfterEach
    void tearDown() {
        AnalysisWarnings.clear();
    }

    @Nested
    @DisplayName("runAnalysis")
    class RunAnalysis {

        @Test
        @DisplayName("should produce a complete result")
        void completeResult() {
            AnalysisResult result = engine.runAnalysis(PROFILE, POSTING);

            assertThat(result.skillFit().mustHave()).extracting(RequirementMatch::requirement)
                    .containsExactly("TypeScript", "React", "GraphQL");
            assertThat(result.skillFit().mustHave()).extracting(RequirementMatch::status)
                    .containsExactly(MatchStatus.MET, MatchStatus.MET, MatchStatus.MISSING);
            assertThat(result.skillFit().niceToHave()).extracting(RequirementMatch::requirement)
                    .containsExactly("Docker");
            assertThat(result.summary().bullets()).hasSizeBetween(2, 3);
            assertThat(result.ats().score()).isBetween(0, 100);
            assertThat(result.roleFocus().recommendations()).isNotEmpty();
            assertThat(result.nextSteps()).isNotEmpty();
        }

        @Test
        @DisplayName("should return the cached result for identical inputs")
        void cached() {
            AnalysisResult first = engine.runAnalysis(PROFILE, POSTING);
            AnalysisResult second = engine.runAnalysis(PROFILE, "\n" + POSTING + "  ");

            assertThat(second).isSameAs(first);
            assertThat(cache.size()).isEqualTo(1);
            verify(statistics, times(1)).trackAnalysis(any(), anyString());
        }

        @Test
        @DisplayName("should reject a missing profile or a blank posting")
        void invalidInput() {
            assertThatThrownBy(() -> engine.runAnalysis(null, POSTING))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessage("Profile data is required");
            assertThatThrownBy(() -> engine.runAnalysis(PROFILE, "   "))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessage("Job posting text is required");
        }

        @Test
        @DisplayName("should raise a warning and still succeed for an oversized posting")
        void oversizedPosting() {
            AnalysisWarnings warnings = AnalysisWarnings.start();

            AnalysisResult result = engine.runAnalysis(PROFILE, POSTING + "x".repeat(InputLimits.MAX_JOB_TEXT_LENGTH));

            assertThat(result).isNotNull();
            assertThat(warnings.warnings()).anyMatch(w -> w.source().equals("inputLimits"));
        }
    }

    @Nested
    @DisplayName("statistics")
    class Statistics {

        @Test
        @DisplayName("should not let a statistics failure reach the caller")
        void failureSwallowed() {
            doThrow(new IllegalStateException("mongo down")).when(statistics).trackAnalysis(any(), anyString());

            AnalysisResult result = engine.runAnalysis(PROFILE, POSTING);

            assertThat(result).isNotNull();
            verify(statistics).trackAnalysis(result, POSTING);
        }

        @Test
        @DisplayName("should not schedule anything when statistics are disabled")
        void disabled() {
            when(statistics.isEnabled()).thenReturn(false);

            engine.runAnalysis(PROFILE, POSTING);

            verifyNoInteractions(executor);
            verify(statistics, never()).trackAnalysis(any(), anyString());
        }
    }
}
