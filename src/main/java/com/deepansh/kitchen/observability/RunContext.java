package com.deepansh.kitchen.observability;

import com.deepansh.kitchen.model.AgentError;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.AgentOutput;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable per-request collector for observability data.
 * Created when a query arrives, filled in by the orchestration loop,
 * then flushed to a {@link WorkflowTrace}.
 *
 * Kept apart from WorkflowState so tracing never affects routing.
 */
@Data
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<DispatchRecord> dispatchRecords = Collections.synchronizedList(new ArrayList<>());

    public void recordDispatch(AgentId agentId, AgentOutput output, int attempts, long latencyMs) {
        String outcome = output instanceof AgentError error ? error.kind().name() : "SUCCESS";
        String detail = output instanceof AgentError error ? error.reason() : null;
        dispatchRecords.add(new DispatchRecord(agentId, outcome, attempts, latencyMs, detail));
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public int totalAttempts() {
        synchronized (dispatchRecords) {
            return dispatchRecords.stream().mapToInt(DispatchRecord::attempts).sum();
        }
    }

    public record DispatchRecord(
            AgentId agentId,
            String outcome,
            int attempts,
            long latencyMs,
            String detail
    ) {}
}
