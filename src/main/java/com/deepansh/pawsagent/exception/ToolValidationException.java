package com.deepansh.pawsagent.exception;

/** Tool input rejected by the handler's input type. Never retried. */
public class ToolValidationException extends AgentException {

    public ToolValidationException(String message) {
        super(message);
    }

    public ToolValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
