package com.example.jobfit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the matching engine.
 */
@ConfigurationProperties(prefix = "jobfit")
public record MatchingProperties(
        Cache cache,
        Statistics statistics
) {

    public MatchingProperties {
        cache = cache != null ? cache : new Cache(0);
        statistics = statistics != null ? statistics : new Statistics(false, null);
    }

    /**
     * Result cache settings.
     *
     * @param maxEntries maximum number of cached analysis results (FIFO eviction)
     */
    public record Cache(int maxEntries) {
        public static final int DEFAULT_MAX_ENTRIES = 100;

        public Cache {
            if (maxEntries <= 0) maxEntries = DEFAULT_MAX_ENTRIES;
        }
    }

    /**
     * Anonymous usage statistics.
     *
     * @param enabled  whether analyses are counted at all
     * @param mongoUri MongoDB connection string of the statistics database
     */
    public record Statistics(boolean enabled, String mongoUri) {
        public static final String DEFAULT_MONGO_URI = "mongodb://localhost:27017/jobfit";

        public Statistics {
            if (mongoUri == null || mongoUri.isBlank()) mongoUri = DEFAULT_MONGO_URI;
        }
    }
}
