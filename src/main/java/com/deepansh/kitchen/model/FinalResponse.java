package com.deepansh.kitchen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Synthesized answer delivered to the presentation layer.
 *
 * {@code sections} follow planner order, one per required agent.
 * {@code warnings} lists every agent whose section is not COMPLETED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinalResponse {

    private String requestId;
    private String sessionId;
    private WorkflowStatus status;

    /** Clarification prompt or error notice; null when sections carry the answer */
    private String message;

    @Builder.Default
    private List<ResponseSection> sections = new ArrayList<>();

    @Builder.Default
    private List<AgentId> warnings = new ArrayList<>();
}
