package com.deepansh.pawsagent.exception;

/**
 * Timeout, network failure, rate limit or 5xx from Redis, the model provider or a tool's
 * backing service. Retried by policy; once retries are exhausted the caller degrades.
 */
public class TransientExternalException extends AgentException {

    public TransientExternalException(String message) {
        super(message);
    }

    public TransientExternalException(String message, Throwable cause) {
        super(message, cause);
    }
}
