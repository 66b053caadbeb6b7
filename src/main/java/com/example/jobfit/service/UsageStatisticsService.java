package com.example.jobfit.service;

import com.example.jobfit.config.MatchingProperties;
import com.example.jobfit.model.AnalysisResult;
import com.example.jobfit.model.UsageStatistics;
import com.example.jobfit.repository.UsageStatisticsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Anonymous usage counters: total analyses, role cluster, industry cluster and ATS bucket.
 * No profile or posting content is ever stored. Disabled unless jobfit.statistics.enabled is set.
 */
@Service
public class UsageStatisticsService {

    private static final Logger log = LoggerFactory.getLogger(UsageStatisticsService.class);

    private final UsageStatisticsRepository repository;
    private final RoleClusterer roleClusterer;
    private final boolean enabled;

    public UsageStatisticsService(UsageStatisticsRepository repository,
                                  RoleClusterer roleClusterer,
                                  MatchingProperties properties) {
        this.repository = repository;
        this.roleClusterer = roleClusterer;
        this.enabled = properties.statistics().enabled();
        log.info("Usage statistics {}", enabled ? "enabled" : "disabled");
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Increments the counters for one completed analysis. Only the ATS score of the result and
     * the clusters derived from the posting are used.
     */
    public void trackAnalysis(AnalysisResult result, String jobPostingText) {
        if (!enabled) return;

        String roleCluster = roleClusterer.roleCluster(jobPostingText);
        String industryCluster = roleClusterer.industryCluster(jobPostingText);
        int atsScore = result != null && result.ats() != null ? result.ats().score() : 0;
        String atsBucket = RoleClusterer.atsScoreBucket(atsScore);

        UsageStatistics updated = load().increment(roleCluster, industryCluster, atsBucket);
        repository.save(updated);
        log.debug("Statistics updated: role={}, industry={}, atsBucket={}, total={}",
                roleCluster, industryCluster, atsBucket, updated.totalAnalyses());
    }

    /**
     * Current counters; all-zero when disabled, when nothing has been stored yet, or when the
     * store cannot be read.
     */
    public UsageStatistics getStatistics() {
        if (!enabled) return UsageStatistics.empty();
        try {
            return load();
        } catch (RuntimeException e) {
            log.warn("Failed to read usage statistics: {}", e.getMessage());
            return UsageStatistics.empty();
        }
    }

    public void resetStatistics() {
        if (!enabled) return;
        repository.save(UsageStatistics.empty());
        log.info("Usage statistics reset");
    }

    private UsageStatistics load() {
        return repository.findById(UsageStatistics.SINGLETON_ID).orElseGet(UsageStatistics::empty);
    }
}
