package com.deepansh.kitchen.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Timeouts, retry policy and dispatch mode of the orchestration loop.
 * Bound from application.yml under the "orchestration" prefix.
 */
@Component
@ConfigurationProperties(prefix = "orchestration")
@Data
public class OrchestrationProperties {

    /** Upper bound for a single adapter call */
    private Duration perCallTimeout = Duration.ofSeconds(20);

    /** Upper bound for the whole dispatch phase of one request */
    private Duration workflowDeadline = Duration.ofSeconds(90);

    /** Attempts per agent, first call included */
    private int maxAttempts = 3;

    private Duration initialBackoff = Duration.ofMillis(500);
    private double backoffMultiplier = 2.0;

    /** Run agents of the same dependency wave concurrently */
    private boolean parallelDispatch = false;
}
