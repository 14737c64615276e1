package com.deepansh.kitchen.core;

import com.deepansh.kitchen.config.OrchestrationProperties;
import com.deepansh.kitchen.exception.IntentResolutionException;
import com.deepansh.kitchen.exception.PlannerConfigurationException;
import com.deepansh.kitchen.intent.ConversationContext;
import com.deepansh.kitchen.intent.IntentResolver;
import com.deepansh.kitchen.memory.ConversationMemory;
import com.deepansh.kitchen.model.Attachment;
import com.deepansh.kitchen.model.FinalResponse;
import com.deepansh.kitchen.model.Intent;
import com.deepansh.kitchen.model.Query;
import com.deepansh.kitchen.model.ResponseSection;
import com.deepansh.kitchen.model.SectionStatus;
import com.deepansh.kitchen.model.WorkflowStatus;
import com.deepansh.kitchen.observability.RunContext;
import com.deepansh.kitchen.observability.TraceService;
import com.deepansh.kitchen.planner.DependencyPlanner;
import com.deepansh.kitchen.planner.ExecutionPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Inbound entry point: one synchronous call per user query.
 *
 * Per-request flow:
 * 1. Load the session's conversation context (Redis)
 * 2. Resolve the intent
 * 3. Plan the agent order
 * 4. Run the orchestration loop, which ends in a synthesized response
 * 5. Append the exchange to the conversation context
 * 6. Async: persist the workflow trace
 *
 * Intent resolution and planner failures end the request in FAILED with a
 * clarification or error message; agent failures never do.
 */
@Service
@Slf4j
public class AssistantService {

    static final String CONFIGURATION_ERROR_MESSAGE = "internal configuration error";

    private final IntentResolver intentResolver;
    private final DependencyPlanner planner;
    private final OrchestrationLoop orchestrationLoop;
    private final ConversationMemory conversationMemory;
    private final TraceService traceService;
    private final OrchestrationProperties properties;

    public AssistantService(IntentResolver intentResolver,
                            DependencyPlanner planner,
                            OrchestrationLoop orchestrationLoop,
                            ConversationMemory conversationMemory,
                            TraceService traceService,
                            OrchestrationProperties properties) {
        this.intentResolver = intentResolver;
        this.planner = planner;
        this.orchestrationLoop = orchestrationLoop;
        this.conversationMemory = conversationMemory;
        this.traceService = traceService;
        this.properties = properties;
    }

    public FinalResponse submitQuery(String text, String sessionId, List<Attachment> attachments) {
        return submitQuery(text, sessionId, attachments, CancellationSignal.none());
    }

    public FinalResponse submitQuery(String text, String sessionId, List<Attachment> attachments,
                                     CancellationSignal cancellation) {
        Query query = new Query(text != null ? text : "", resolveSessionId(sessionId), Instant.now(), attachments);
        String requestId = UUID.randomUUID().toString();

        log.info("Query received [request={}, session={}, attachments={}, text='{}']",
                requestId, query.sessionId(), query.attachments().size(), query.text());

        RunContext runCtx = new RunContext();
        Intent intent = null;
        ExecutionPlan plan = null;
        WorkflowState state = null;
        FinalResponse response = null;
        Throwable error = null;

        try {
            ConversationContext context = conversationMemory.load(query.sessionId());
            intent = intentResolver.resolve(query.text(), context);
            plan = planner.plan(intent);
            log.info("Planned {} [request={}]", plan.waves(), requestId);

            state = new WorkflowState(requestId, query, intent, plan);
            response = orchestrationLoop.run(state,
                    Deadline.after(properties.getWorkflowDeadline()), cancellation, runCtx);

            conversationMemory.append(context, query.text(), summarize(response));

        } catch (IntentResolutionException e) {
            log.warn("Intent resolution failed [request={}]: {}", requestId, e.getMessage());
            error = e;
            response = failed(requestId, query.sessionId(), IntentResolver.CLARIFICATION_PROMPT);
        } catch (PlannerConfigurationException e) {
            log.error("Planner misconfiguration [request={}]", requestId, e);
            error = e;
            response = failed(requestId, query.sessionId(), CONFIGURATION_ERROR_MESSAGE);
        } catch (RuntimeException e) {
            log.error("Query failed [request={}, session={}]", requestId, query.sessionId(), e);
            error = e;
            throw e;
        } finally {
            // Always persist the trace, even on error
            traceService.persistTrace(traceService.buildTrace(requestId, query, intent, plan,
                    state != null ? state.history() : List.of(), response, runCtx, error));
        }

        log.info("Query complete [request={}, status={}, sections={}, warnings={}, latency={}ms, attempts={}]",
                requestId, response.getStatus(), response.getSections().size(), response.getWarnings(),
                runCtx.elapsedMs(), runCtx.totalAttempts());
        return response;
    }

    public void resetSession(String sessionId) {
        conversationMemory.clear(sessionId);
    }

    private FinalResponse failed(String requestId, String sessionId, String message) {
        return FinalResponse.builder()
                .requestId(requestId)
                .sessionId(sessionId)
                .status(WorkflowStatus.FAILED)
                .message(message)
                .build();
    }

    /** Short text remembered for the next turn's intent resolution. */
    private String summarize(FinalResponse response) {
        if (response.getSections().isEmpty()) {
            return response.getMessage();
        }
        return response.getSections().stream()
                .filter(s -> s.getStatus() == SectionStatus.COMPLETED)
                .map(ResponseSection::getContent)
                .map(c -> c.lines().findFirst().orElse(""))
                .collect(Collectors.joining(" | "));
    }

    private String resolveSessionId(String provided) {
        return (provided != null && !provided.isBlank()) ? provided : UUID.randomUUID().toString();
    }
}
