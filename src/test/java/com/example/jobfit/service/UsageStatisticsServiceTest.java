package com.example.jobfit.service;

import com.example.jobfit.config.MatchingProperties;
import com.example.jobfit.model.AnalysisResult;
import com.example.jobfit.model.AtsAnalysis;
import com.example.jobfit.model.AtsBreakdown;
import com.example.jobfit.model.UsageStatistics;
import com.example.jobfit.repository.UsageStatisticsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class UsageStatisticsServiceTest {

    private UsageStatisticsRepository repository;

    @BeforeEach
    void setUp() {
        repository = mock(UsageStatisticsRepository.class);
    }

    private UsageStatisticsService service(boolean enabled) {
        MatchingProperties properties = new MatchingProperties(
                new MatchingProperties.Cache(10),
                new MatchingProperties.Statistics(enabled, null));
        return new UsageStatisticsService(repository, new RoleClusterer(), properties);
    }

    private static AnalysisResult resultWithAtsScore(int score) {
        AtsAnalysis ats = new AtsAnalysis(score, AtsBreakdown.zero(), List.of());
        return new AnalysisResult(null, null, List.of(), ats, null, List.of());
    }

    @Nested
    @DisplayName("when disabled")
    class Disabled {

        @Test
        @DisplayName("should never touch the repository")
        void noOp() {
            UsageStatisticsService service = service(false);

            service.trackAnalysis(resultWithAtsScore(50), "Software Engineer");
            service.resetStatistics();
            UsageStatistics stats = service.getStatistics();

            assertThat(service.isEnabled()).isFalse();
            assertThat(stats.totalAnalyses()).isZero();
            verifyNoInteractions(repository);
        }
    }

    @Nested
    @DisplayName("when enabled")
    class Enabled {

        @Test
        @DisplayName("should increment total, role, industry and ATS bucket counters")
        void increments() {
            when(repository.findById(UsageStatistics.SINGLETON_ID)).thenReturn(Optional.empty());
            UsageStatisticsService service = service(true);

            service.trackAnalysis(resultWithAtsScore(72), "Senior Software Engineer\nWe are a fintech company");

            ArgumentCaptor<UsageStatistics> saved = ArgumentCaptor.forClass(UsageStatistics.class);
            verify(repository).save(saved.capture());
            UsageStatistics stats = saved.getValue();
            assertThat(stats.id()).isEqualTo(UsageStatistics.SINGLETON_ID);
            assertThat(stats.totalAnalyses()).isEqualTo(1);
            assertThat(stats.roleClusterCounts()).containsEntry("Software Engineer", 1L);
            assertThat(stats.industryClusterCounts()).containsEntry("Finance", 1L);
            assertThat(stats.atsScoreBuckets()).containsEntry("high", 1L).containsEntry("low", 0L);
        }

        @Test
        @DisplayName("should add to existing counters")
        void addsToExisting() {
            UsageStatistics existing = new UsageStatistics(UsageStatistics.SINGLETON_ID, 4,
                    Map.of("Designer", 4L), Map.of("Unknown", 4L), Map.of("medium", 4L));
            when(repository.findById(UsageStatistics.SINGLETON_ID)).thenReturn(Optional.of(existing));
            UsageStatisticsService service = service(true);

            service.trackAnalysis(resultWithAtsScore(50), "UX Designer");

            ArgumentCaptor<UsageStatistics> saved = ArgumentCaptor.forClass(UsageStatistics.class);
            verify(repository).save(saved.capture());
            assertThat(saved.getValue().totalAnalyses()).isEqualTo(5);
            assertThat(saved.getValue().roleClusterCounts()).containsEntry("Designer", 5L);
            assertThat(saved.getValue().atsScoreBuckets()).containsEntry("medium", 5L);
        }

        @Test
        @DisplayName("should return empty counters when the store cannot be read")
        void readFailure() {
            when(repository.findById(any())).thenThrow(new IllegalStateException("connection refused"));
            UsageStatisticsService service = service(true);

            UsageStatistics stats = service.getStatistics();

            assertThat(stats.totalAnalyses()).isZero();
            assertThat(stats.atsScoreBuckets()).containsOnlyKeys(
                    "very_low", "low", "medium", "high", "very_high", "unknown");
        }

        @Test
        @DisplayName("reset should overwrite the counters document with zeros")
        void reset() {
            UsageStatisticsService service = service(true);

            service.resetStatistics();

            ArgumentCaptor<UsageStatistics> saved = ArgumentCaptor.forClass(UsageStatistics.class);
            verify(repository).save(saved.capture());
            assertThat(saved.getValue().totalAnalyses()).isZero();
            assertThat(saved.getValue().roleClusterCounts()).isEmpty();
        }
    }
}
