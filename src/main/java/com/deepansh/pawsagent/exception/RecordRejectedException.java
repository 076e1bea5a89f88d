package com.deepansh.pawsagent.exception;

import lombok.Getter;

/**
 * The records service refused a request (4xx). Not retried: the same request would
 * be refused again. Tools turn it into a failed ToolResult the model can explain.
 */
@Getter
public class RecordRejectedException extends AgentException {

    private final int status;

    public RecordRejectedException(int status, String message) {
        super(message);
        this.status = status;
    }
}
