package com.deepansh.kitchen.core;

import com.deepansh.kitchen.agent.AgentInvocation;
import com.deepansh.kitchen.agent.KitchenAgent;
import com.deepansh.kitchen.config.OrchestrationProperties;
import com.deepansh.kitchen.exception.PermanentAgentException;
import com.deepansh.kitchen.exception.TransientAgentException;
import com.deepansh.kitchen.model.AgentError;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.AgentOutput;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Invokes one adapter under a per-call timeout with bounded, exponential
 * retry of transient failures.
 *
 * Never throws: every failure is turned into an {@link AgentError}.
 * - transient failure on every attempt  -> RETRIES_EXHAUSTED
 * - deadline expired while retrying     -> DEADLINE_EXCEEDED
 * - permanent or unexpected failure     -> PERMANENT, no retry
 *
 * All attempts share the caller's {@link AgentInvocation}, so adapters see
 * the same invocation id every time. Timed-out calls are not interrupted.
 */
@Component
@Slf4j
public class AgentDispatcher {

    private static final Duration MIN_CALL_TIMEOUT = Duration.ofMillis(1);

    private final OrchestrationProperties properties;
    private final Executor callExecutor;

    public AgentDispatcher(OrchestrationProperties properties,
                           @Qualifier("agentCallExecutor") Executor callExecutor) {
        this.properties = properties;
        this.callExecutor = callExecutor;
    }

    public DispatchOutcome dispatch(KitchenAgent agent, AgentInvocation invocation, Deadline deadline) {
        AgentId agentId = agent.id();
        AtomicInteger attempts = new AtomicInteger();
        long start = System.currentTimeMillis();

        Retry retry = Retry.of("agent-" + agentId.wireName(), retryConfig(deadline));
        retry.getEventPublisher().onRetry(event -> log.warn(
                "Retrying agent [{}] after attempt {} in {}ms [invocation={}]: {}",
                agentId, event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                invocation.invocationId(), messageOf(event.getLastThrowable())));

        Supplier<AgentOutput> attempt = () -> {
            if (attempts.get() > 0 && deadline.isExpired()) {
                throw new TransientAgentException("Workflow deadline expired before next attempt");
            }
            attempts.incrementAndGet();
            return callWithTimeout(agent, invocation, deadline);
        };

        AgentOutput output;
        try {
            output = Retry.decorateSupplier(retry, attempt).get();
            if (output == null || output.agentId() != agentId) {
                throw new PermanentAgentException("Adapter returned an output for "
                        + (output == null ? "nobody" : output.agentId()));
            }
        } catch (TransientAgentException e) {
            AgentError.Kind kind = deadline.isExpired()
                    ? AgentError.Kind.DEADLINE_EXCEEDED
                    : AgentError.Kind.RETRIES_EXHAUSTED;
            log.warn("Agent [{}] gave up after {} attempt(s) [{}]: {}",
                    agentId, attempts.get(), kind, e.getMessage());
            output = new AgentError(agentId, e.getMessage(), kind, attempts.get());
        } catch (PermanentAgentException e) {
            log.warn("Agent [{}] failed permanently: {}", agentId, e.getMessage());
            output = new AgentError(agentId, e.getMessage(), AgentError.Kind.PERMANENT, attempts.get());
        } catch (RuntimeException e) {
            log.error("Agent [{}] failed unexpectedly [invocation={}]", agentId, invocation.invocationId(), e);
            output = new AgentError(agentId, "Unexpected failure: " + messageOf(e),
                    AgentError.Kind.PERMANENT, attempts.get());
        }

        return new DispatchOutcome(output, attempts.get(), System.currentTimeMillis() - start);
    }

    private AgentOutput callWithTimeout(KitchenAgent agent, AgentInvocation invocation, Deadline deadline) {
        Duration timeout = effectiveTimeout(deadline);
        TimeLimiter timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(false)
                .build());
        try {
            return timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(() -> agent.execute(invocation), callExecutor));
        } catch (TimeoutException e) {
            throw new TransientAgentException("Agent " + agent.id() + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PermanentAgentException("Interrupted while waiting for " + agent.id(), e);
        } catch (Exception e) {
            throw new PermanentAgentException("Agent " + agent.id() + " failed: " + messageOf(e), e);
        }
    }

    private RetryConfig retryConfig(Deadline deadline) {
        IntervalFunction backoff = IntervalFunction.ofExponentialBackoff(
                properties.getInitialBackoff().toMillis(), properties.getBackoffMultiplier());
        IntervalFunction boundedByDeadline =
                attempt -> Math.min(backoff.apply(attempt), deadline.remaining().toMillis());

        return RetryConfig.custom()
                .maxAttempts(Math.max(1, properties.getMaxAttempts()))
                .intervalFunction(boundedByDeadline)
                .retryOnException(e -> e instanceof TransientAgentException && !deadline.isExpired())
                .failAfterMaxAttempts(false)
                .build();
    }

    private Duration effectiveTimeout(Deadline deadline) {
        Duration perCall = properties.getPerCallTimeout();
        Duration remaining = deadline.remaining();
        Duration timeout = remaining.compareTo(perCall) < 0 ? remaining : perCall;
        return timeout.compareTo(MIN_CALL_TIMEOUT) < 0 ? MIN_CALL_TIMEOUT : timeout;
    }

    private static String messageOf(Throwable t) {
        if (t == null) {
            return "unknown";
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
