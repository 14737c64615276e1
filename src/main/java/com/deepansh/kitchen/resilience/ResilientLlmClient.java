package com.deepansh.kitchen.resilience;

import com.deepansh.kitchen.exception.LlmException;
import com.deepansh.kitchen.llm.LlmClient;
import com.deepansh.kitchen.llm.LlmResponse;
import com.deepansh.kitchen.llm.Message;
import com.deepansh.kitchen.llm.ResponseFormat;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the active provider client that adds a circuit breaker.
 *
 * No retry here: the orchestration loop owns retry and backoff per agent.
 *
 * Circuit breaker config (application.yml, instance "llmClient"):
 * - Opens after 50% failure rate in a sliding window of 10 calls
 * - Waits 30s before allowing probe calls (half-open state)
 * - Only retryable LlmExceptions are recorded as failures (LlmOutagePredicate);
 *   caller errors are not outages
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @CircuitBreaker(name = "llmClient", fallbackMethod = "circuitBreakerFallback")
    public LlmResponse chat(List<Message> messages, ResponseFormat format) {
        return delegate.chat(messages, format);
    }

    /**
     * Only the open-circuit case is converted; every other failure is rethrown
     * unchanged so callers still see the provider's classification.
     * An open circuit is reported as retryable: it closes again on its own.
     */
    public LlmResponse circuitBreakerFallback(List<Message> messages,
                                              ResponseFormat format,
                                              CallNotPermittedException ex) {
        log.error("LLM circuit breaker is OPEN, rejecting call: {}", ex.getMessage());
        throw new LlmException("The AI service is temporarily unavailable (circuit open)", true, ex);
    }
}
