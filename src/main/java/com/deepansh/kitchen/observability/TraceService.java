package com.deepansh.kitchen.observability;

import com.deepansh.kitchen.core.Transition;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.FinalResponse;
import com.deepansh.kitchen.model.Intent;
import com.deepansh.kitchen.model.Query;
import com.deepansh.kitchen.model.WorkflowStatus;
import com.deepansh.kitchen.planner.ExecutionPlan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Persists workflow traces and serves them back per session.
 *
 * The trace is assembled on the request thread from immutable snapshots;
 * only the write is @Async, so it never delays the response.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    private static final int MAX_QUERY_CHARS = 4000;

    private final WorkflowTraceRepository traceRepository;

    /**
     * Builds the trace for one request. {@code intent}, {@code plan} and
     * {@code response} are null when the request failed before reaching them.
     */
    public WorkflowTrace buildTrace(String requestId, Query query, Intent intent, ExecutionPlan plan,
                                    List<Transition> transitions, FinalResponse response,
                                    RunContext runCtx, Throwable error) {
        WorkflowStatus status = response != null ? response.getStatus() : WorkflowStatus.FAILED;

        return WorkflowTrace.builder()
                .requestId(requestId)
                .sessionId(query.sessionId())
                .queryText(truncate(query.text(), MAX_QUERY_CHARS))
                .requiredAgents(intent != null ? wireNames(intent.requiredAgents()) : List.of())
                .entities(intent != null ? intent.entities() : Map.of())
                .confidence(intent != null ? intent.confidence() : 0.0)
                .plan(plan != null ? plan.waves().stream().map(TraceService::wireNames).toList() : List.of())
                .transitions(transitions.stream()
                        .map(t -> new WorkflowTrace.TransitionEntry(t.from().name(), t.to().name(),
                                wireNames(t.agents()), t.note(), t.at()))
                        .toList())
                .dispatches(List.copyOf(runCtx.getDispatchRecords()).stream()
                        .map(r -> new WorkflowTrace.DispatchEntry(r.agentId().wireName(), r.outcome(),
                                r.attempts(), r.latencyMs(), r.detail()))
                        .toList())
                .status(status)
                .warnings(response != null ? wireNames(response.getWarnings()) : List.of())
                .totalLatencyMs(runCtx.elapsedMs())
                .errorMessage(error != null ? error.getMessage() : null)
                .build();
    }

    @Async("traceTaskExecutor")
    public void persistTrace(WorkflowTrace trace) {
        try {
            traceRepository.save(trace);
            log.info("Trace persisted [request={}, status={}, latency={}ms, dispatches={}]",
                    trace.getRequestId(), trace.getStatus(), trace.getTotalLatencyMs(), trace.getDispatches().size());
        } catch (Exception e) {
            // Trace persistence must never crash the app
            log.error("Failed to persist workflow trace for request={}", trace.getRequestId(), e);
        }
    }

    public List<WorkflowTrace> getTracesForSession(String sessionId) {
        return traceRepository.findBySessionIdOrderByCreatedAtDesc(sessionId);
    }

    private static List<String> wireNames(List<AgentId> agents) {
        return agents.stream().map(AgentId::wireName).toList();
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}
