package com.deepansh.pawsagent.observability;

public enum RunOutcome {
    /** Model produced a final reply */
    REPLIED,
    /** Inbound message id already processed */
    DUPLICATE,
    /** Termination keyword ended the session */
    TERMINATED,
    /** Round budget exhausted while the model kept calling tools */
    SAFETY_BREAK,
    ERROR
}
