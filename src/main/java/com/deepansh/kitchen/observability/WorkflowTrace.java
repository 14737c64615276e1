package com.deepansh.kitchen.observability;

import com.deepansh.kitchen.model.WorkflowStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Audit record of one request: intent, plan, every state transition,
 * per-agent dispatch outcome and the final status.
 */
@Document(collection = "workflow_traces")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowTrace {

    @Id
    private String id;

    @Indexed
    private String requestId;

    @Indexed
    private String sessionId;

    private String queryText;

    private List<String> requiredAgents;
    private Map<String, String> entities;
    private double confidence;
    private List<List<String>> plan;

    @Builder.Default
    private List<TransitionEntry> transitions = new ArrayList<>();

    @Builder.Default
    private List<DispatchEntry> dispatches = new ArrayList<>();

    private WorkflowStatus status;
    private List<String> warnings;
    private long totalLatencyMs;

    /** Set when the request failed before or outside the loop */
    private String errorMessage;

    @CreatedDate
    private Instant createdAt;

    public record TransitionEntry(String from, String to, List<String> agents, String note, Instant at) {}

    public record DispatchEntry(String agent, String outcome, int attempts, long latencyMs, String detail) {}
}
