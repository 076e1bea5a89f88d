package com.deepansh.pawsagent.exception;

public class ProtocolInconsistencyException extends AgentException {

    public ProtocolInconsistencyException(String message) {
        super(message);
    }
}
