package com.deepansh.kitchen.core;

import com.deepansh.kitchen.agent.AgentInvocation;
import com.deepansh.kitchen.agent.AgentRegistry;
import com.deepansh.kitchen.agent.KitchenAgent;
import com.deepansh.kitchen.agent.PriorOutputs;
import com.deepansh.kitchen.config.OrchestrationProperties;
import com.deepansh.kitchen.model.AgentError;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.FinalResponse;
import com.deepansh.kitchen.model.WorkflowStatus;
import com.deepansh.kitchen.observability.RunContext;
import com.deepansh.kitchen.response.ResponseSynthesizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * State machine that drives one workflow from ROUTING to DONE.
 *
 * ROUTING      picks the next batch in planner order, or moves on to
 *              SYNTHESIZING when nothing is pending, the deadline has
 *              passed, or the request was cancelled.
 * DISPATCHING  runs the batch and records one output per member.
 * SYNTHESIZING builds the final response from the recorded outputs.
 *
 * A batch is one agent, or a whole dependency wave when parallel dispatch
 * is on. Every dispatched agent is recorded whatever the outcome, so the
 * completed set grows on each cycle and the loop ends after at most
 * |requiredAgents| dispatch cycles.
 */
@Component
@Slf4j
public class OrchestrationLoop {

    private final AgentRegistry agentRegistry;
    private final AgentDispatcher dispatcher;
    private final ResponseSynthesizer synthesizer;
    private final OrchestrationProperties properties;
    private final Executor batchExecutor;

    public OrchestrationLoop(AgentRegistry agentRegistry,
                             AgentDispatcher dispatcher,
                             ResponseSynthesizer synthesizer,
                             OrchestrationProperties properties,
                             @Qualifier("batchDispatchExecutor") Executor batchExecutor) {
        this.agentRegistry = agentRegistry;
        this.dispatcher = dispatcher;
        this.synthesizer = synthesizer;
        this.properties = properties;
        this.batchExecutor = batchExecutor;
    }

    public FinalResponse run(WorkflowState state, Deadline deadline, CancellationSignal cancellation, RunContext runCtx) {
        if (state.status() != WorkflowStatus.ROUTING) {
            throw new IllegalStateException("Workflow " + state.requestId() + " already in " + state.status());
        }

        int maxCycles = state.intent().requiredAgents().size();
        int cycles = 0;
        List<AgentId> batch = List.of();
        FinalResponse response = null;

        while (!state.status().isTerminal()) {
            switch (state.status()) {
                case ROUTING -> batch = route(state, deadline, cancellation);
                case DISPATCHING -> {
                    if (++cycles > maxCycles) {
                        throw new IllegalStateException("Dispatch cycles exceeded " + maxCycles
                                + " for workflow " + state.requestId());
                    }
                    dispatchBatch(state, batch, deadline, runCtx);
                }
                case SYNTHESIZING -> response = synthesize(state);
                default -> throw new IllegalStateException("Unexpected status " + state.status());
            }
        }
        return response;
    }

    private List<AgentId> route(WorkflowState state, Deadline deadline, CancellationSignal cancellation) {
        List<AgentId> pending = state.pending();

        if (pending.isEmpty()) {
            state.transitionTo(WorkflowStatus.SYNTHESIZING, "all required agents completed");
            return List.of();
        }
        if (cancellation.isCancelled()) {
            log.warn("Workflow cancelled, skipping {} [request={}]", pending, state.requestId());
            state.transitionTo(WorkflowStatus.SYNTHESIZING, pending, "cancelled");
            return List.of();
        }
        if (deadline.isExpired()) {
            log.warn("Workflow deadline expired, skipping {} [request={}]", pending, state.requestId());
            state.transitionTo(WorkflowStatus.SYNTHESIZING, pending, "deadline expired");
            return List.of();
        }

        List<AgentId> batch = properties.isParallelDispatch() ? state.nextWave() : List.of(pending.get(0));
        state.transitionTo(WorkflowStatus.DISPATCHING, batch, "dispatch");
        return batch;
    }

    private void dispatchBatch(WorkflowState state, List<AgentId> batch, Deadline deadline, RunContext runCtx) {
        int completedBefore = state.completedAgents().size();
        PriorOutputs prior = state.priorOutputsView();
        List<DispatchOutcome> outcomes;

        if (batch.size() == 1) {
            outcomes = List.of(dispatchOne(state, batch.get(0), prior, deadline));
        } else {
            log.info("Dispatching wave {} concurrently [request={}]", batch, state.requestId());
            List<CompletableFuture<DispatchOutcome>> futures = new ArrayList<>();
            for (AgentId agentId : batch) {
                futures.add(submit(state, agentId, prior, deadline));
            }
            outcomes = new ArrayList<>();
            for (int i = 0; i < batch.size(); i++) {
                outcomes.add(await(batch.get(i), futures.get(i)));
            }
        }

        // recorded in planner order, whatever order the calls finished in
        for (int i = 0; i < batch.size(); i++) {
            AgentId agentId = batch.get(i);
            DispatchOutcome outcome = outcomes.get(i);
            state.record(agentId, outcome.output());
            runCtx.recordDispatch(agentId, outcome.output(), outcome.attempts(), outcome.latencyMs());
            log.info("Agent [{}] finished: {} in {}ms after {} attempt(s) [request={}]",
                    agentId, outcome.output().isSuccess() ? "success" : "error",
                    outcome.latencyMs(), outcome.attempts(), state.requestId());
        }

        if (state.completedAgents().size() <= completedBefore) {
            throw new IllegalStateException("Dispatch cycle made no progress for " + batch);
        }
        state.transitionTo(WorkflowStatus.ROUTING, batch, "recorded");
    }

    private CompletableFuture<DispatchOutcome> submit(WorkflowState state, AgentId agentId,
                                                      PriorOutputs prior, Deadline deadline) {
        try {
            return CompletableFuture.supplyAsync(() -> dispatchOne(state, agentId, prior, deadline), batchExecutor);
        } catch (RuntimeException e) {
            log.error("Could not schedule agent [{}] [request={}]", agentId, state.requestId(), e);
            return CompletableFuture.completedFuture(failed(agentId, "Could not schedule: " + e.getMessage()));
        }
    }

    private DispatchOutcome await(AgentId agentId, CompletableFuture<DispatchOutcome> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            log.error("Agent [{}] batch task failed", agentId, e.getCause());
            return failed(agentId, "Dispatch failed: " + e.getCause());
        }
    }

    private DispatchOutcome dispatchOne(WorkflowState state, AgentId agentId, PriorOutputs prior, Deadline deadline) {
        Optional<KitchenAgent> agent = agentRegistry.find(agentId);
        if (agent.isEmpty()) {
            log.error("No adapter registered for required agent [{}]", agentId);
            return failed(agentId, "No adapter registered for " + agentId.wireName());
        }

        AgentInvocation invocation = new AgentInvocation(
                AgentInvocation.invocationIdFor(state.requestId(), agentId),
                state.query().sessionId(),
                state.query().text(),
                state.intent().entities(),
                state.intent().signals(),
                prior);

        log.info("Dispatching agent [{}] [invocation={}]", agentId, invocation.invocationId());
        return dispatcher.dispatch(agent.get(), invocation, deadline);
    }

    private FinalResponse synthesize(WorkflowState state) {
        FinalResponse response = synthesizer.synthesize(
                state.intent(), state.plan(), state.outputs(), state.completedAgents());
        response.setRequestId(state.requestId());
        response.setSessionId(state.query().sessionId());
        state.transitionTo(WorkflowStatus.DONE, response.getWarnings(), "synthesized");
        response.setStatus(WorkflowStatus.DONE);
        return response;
    }

    private static DispatchOutcome failed(AgentId agentId, String reason) {
        return new DispatchOutcome(new AgentError(agentId, reason, AgentError.Kind.PERMANENT, 0), 0, 0);
    }
}
