package com.example.jobfit.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Anonymous, aggregated usage counters stored in MongoDB (collection usage_statistics).
 * Holds no profile or posting content, no per-run records and no timestamps.
 */
@Document(collection = "usage_statistics")
public record UsageStatistics(
        @Id String id,
        long totalAnalyses,
        Map<String, Long> roleClusterCounts,
        Map<String, Long> industryClusterCounts,
        Map<String, Long> atsScoreBuckets
) {
    public static final String SINGLETON_ID = "statistics";

    public UsageStatistics {
        roleClusterCounts = sorted(roleClusterCounts);
        industryClusterCounts = sorted(industryClusterCounts);
        atsScoreBuckets = sorted(atsScoreBuckets);
    }

    public static UsageStatistics empty() {
        Map<String, Long> buckets = new LinkedHashMap<>();
        for (String bucket : List.of("very_low", "low", "medium", "high", "very_high", "unknown")) {
            buckets.put(bucket, 0L);
        }
        return new UsageStatistics(SINGLETON_ID, 0, Map.of(), Map.of(), buckets);
    }

    /** Returns a copy with every counter of one analysis incremented. */
    public UsageStatistics increment(String roleCluster, String industryCluster, String atsBucket) {
        return new UsageStatistics(
                id,
                totalAnalyses + 1,
                incremented(roleClusterCounts, roleCluster),
                incremented(industryClusterCounts, industryCluster),
                incremented(atsScoreBuckets, atsBucket)
        );
    }

    private static Map<String, Long> sorted(Map<String, Long> counts) {
        return counts != null ? Collections.unmodifiableMap(new TreeMap<>(counts)) : Map.of();
    }

    private static Map<String, Long> incremented(Map<String, Long> counts, String key) {
        Map<String, Long> copy = new LinkedHashMap<>(counts);
        copy.merge(key, 1L, Long::sum);
        return copy;
    }
}
