package com.example.jobfit.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.SimpleMongoClientDatabaseFactory;

/**
 * Points the statistics repository at the database configured under jobfit.statistics.mongo-uri.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoDatabaseFactory mongoDatabaseFactory(MatchingProperties properties) {
        return new SimpleMongoClientDatabaseFactory(properties.statistics().mongoUri());
    }
}
