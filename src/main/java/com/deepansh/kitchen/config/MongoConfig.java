package com.deepansh.kitchen.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Mongo auditing fills @CreatedDate / @LastModifiedDate on save.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = {
    "com.deepansh.kitchen.inventory",
    "com.deepansh.kitchen.nutrition",
    "com.deepansh.kitchen.observability"
})
public class MongoConfig {
}
