package com.example.jobfit.config;

import com.example.jobfit.service.ResultCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Beans shared by the analysis pipeline.
 */
@Configuration
public class AnalysisConfig {

    /**
     * In-process result cache, sized from jobfit.cache.max-entries.
     */
    @Bean
    public ResultCache resultCache(MatchingProperties properties) {
        return new ResultCache(properties.cache().maxEntries());
    }

    /**
     * Single background thread for fire-and-forget statistics updates.
     * One thread serializes the read-increment-write cycle on the counters document.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService statisticsExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "usage-statistics");
            thread.setDaemon(true);
            return thread;
        });
    }
}
