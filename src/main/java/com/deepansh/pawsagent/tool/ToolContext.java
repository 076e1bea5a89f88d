package com.deepansh.pawsagent.tool;

/**
 * Per-call execution context.
 *
 * @param requestId        id of the loop run, used as log prefix
 * @param identity         raw sender identity; tools normalize it as they need
 * @param inboundMessageId provider message id, may be null
 */
public record ToolContext(String requestId, String identity, String inboundMessageId) {

    /** Scopes idempotency keys: the inbound message, else the run itself. */
    public String messageKey() {
        return inboundMessageId != null && !inboundMessageId.isBlank() ? inboundMessageId : requestId;
    }
}
