package com.deepansh.pawsagent.llm;

import com.deepansh.pawsagent.exception.AgentException;
import com.deepansh.pawsagent.exception.TransientExternalException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Decorator around the provider adapter that adds retry + circuit breaker.
 *
 * Marked {@code @Primary} so the agent loop gets this bean, not the raw adapter.
 *
 * Retry config (application.yml, instance "modelClient"):
 * - 3 attempts, exponential backoff from 1s
 * - retries TransientExternalException and I/O errors; ModelClientException is ignored
 *
 * Circuit breaker config:
 * - opens after 50% failures in a window of 10 calls, half-opens after 30s
 * - ModelClientException does not count as a failure
 *
 * Unlike a degraded reply, the fallback keeps the failure an exception: the loop
 * owns the user-facing apology and records the run as failed.
 */
@Component
@Primary
@Slf4j
public class ResilientModelClient implements ModelClient {

    private final ModelClient delegate;

    public ResilientModelClient(@Qualifier("anthropicModelClient") ModelClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "modelClient", fallbackMethod = "fallback")
    @CircuitBreaker(name = "modelClient", fallbackMethod = "fallback")
    public ModelResponse complete(ModelRequest request) {
        return delegate.complete(request);
    }

    /**
     * Shared by retry and circuit breaker. Failures already in the agent hierarchy pass
     * through unchanged; anything else becomes transient.
     */
    public ModelResponse fallback(ModelRequest request, Throwable ex) {
        if (ex instanceof CallNotPermittedException) {
            log.error("Model circuit breaker is OPEN — rejecting call: {}", ex.getMessage());
            throw new TransientExternalException("Model provider circuit open", ex);
        }
        if (ex instanceof AgentException) {
            log.error("Model call failed: {}", ex.getMessage());
            throw (AgentException) ex;
        }
        log.error("Model call failed unexpectedly: {}", ex.getMessage());
        throw new TransientExternalException("Model call failed: " + ex.getMessage(), ex);
    }
}
