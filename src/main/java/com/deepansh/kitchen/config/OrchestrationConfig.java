package com.deepansh.kitchen.config;

import com.deepansh.kitchen.agent.AgentRegistry;
import com.deepansh.kitchen.agent.KitchenAgent;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.planner.DependencyPlanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * Builds the immutable agent registry and the dependency planner once at
 * start-up. A cyclic dependency table fails here, before any request.
 */
@Configuration
@Slf4j
public class OrchestrationConfig {

    @Bean
    public AgentRegistry agentRegistry(List<KitchenAgent> agents) {
        AgentRegistry registry = new AgentRegistry(agents);
        Arrays.stream(AgentId.values())
                .filter(id -> !registry.hasAgent(id))
                .forEach(id -> log.warn("No adapter registered for agent [{}]; it will always degrade", id));
        return registry;
    }

    @Bean
    public DependencyPlanner dependencyPlanner() {
        return DependencyPlanner.withDefaultRules();
    }
}
