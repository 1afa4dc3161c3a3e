package com.amblue.agent.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Enable MongoDB auditing so @CreatedDate is populated on run traces.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = "com.amblue.agent.observability")
public class MongoConfig {
}
