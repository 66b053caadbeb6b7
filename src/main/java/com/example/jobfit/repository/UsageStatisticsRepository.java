package com.example.jobfit.repository;

import com.example.jobfit.model.UsageStatistics;
import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Repository for the aggregated usage counters (collection usage_statistics).
 */
public interface UsageStatisticsRepository extends MongoRepository<UsageStatistics, String> {
}
