package com.deepansh.pawsagent.exception;

/**
 * Non-retryable provider failure: bad API key, rejected request, unparseable response.
 * Listed under ignore-exceptions for both the retry and the circuit breaker.
 */
public class ModelClientException extends AgentException {

    public ModelClientException(String message) {
        super(message);
    }

    public ModelClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
