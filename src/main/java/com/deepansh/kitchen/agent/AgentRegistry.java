package com.deepansh.kitchen.agent;

import com.deepansh.kitchen.model.AgentId;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable {@code AgentId -> KitchenAgent} map, built once at start-up and
 * handed to the orchestration loop.
 *
 * Spring injects every {@link KitchenAgent} bean as a list. Two beans claiming
 * the same id is a wiring error and fails start-up.
 */
@Slf4j
public final class AgentRegistry {

    private final Map<AgentId, KitchenAgent> agents;

    public AgentRegistry(List<KitchenAgent> agentBeans) {
        Map<AgentId, KitchenAgent> byId = new EnumMap<>(AgentId.class);
        for (KitchenAgent agent : agentBeans) {
            KitchenAgent previous = byId.putIfAbsent(agent.id(), agent);
            if (previous != null) {
                throw new IllegalStateException("Two agents registered for " + agent.id() + ": "
                        + previous.getClass().getSimpleName() + " and " + agent.getClass().getSimpleName());
            }
            log.info("Registered agent: [{}] -> {}", agent.id(), agent.getClass().getSimpleName());
        }
        this.agents = Collections.unmodifiableMap(byId);
        log.info("Total agents registered: {}", agents.size());
    }

    public Optional<KitchenAgent> find(AgentId id) {
        return Optional.ofNullable(agents.get(id));
    }

    public boolean hasAgent(AgentId id) {
        return agents.containsKey(id);
    }

    public int agentCount() {
        return agents.size();
    }
}
