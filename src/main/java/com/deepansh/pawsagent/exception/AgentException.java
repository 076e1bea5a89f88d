package com.deepansh.pawsagent.exception;

/**
 * Base unchecked exception for the agent. Subtypes carry the failure category
 * (validation, transient external failure, protocol inconsistency, provider error).
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
