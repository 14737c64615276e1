package com.deepansh.kitchen.resilience;

import com.deepansh.kitchen.exception.LlmException;

import java.util.function.Predicate;

/**
 * Failure predicate for the "llmClient" circuit breaker: only retryable
 * provider errors (429, 5xx, network) count towards opening the circuit.
 * Caller errors such as a bad request or a decommissioned model are not outages.
 */
public class LlmOutagePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof LlmException && ((LlmException) throwable).isRetryable();
    }
}
