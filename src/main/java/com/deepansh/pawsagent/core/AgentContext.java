package com.deepansh.pawsagent.core;

import com.deepansh.pawsagent.session.Session;
import com.deepansh.pawsagent.tool.ToolContext;
import lombok.Builder;
import lombok.Data;

/**
 * Holds all mutable state for a single loop run.
 * Passed through the rounds instead of scattered fields on AgentLoop.
 */
@Data
@Builder
public class AgentContext {

    private String requestId;
    private String identity;
    private String inboundMessageId;
    private String userInput;

    /** Latest persisted session; replaced after every append */
    private Session session;

    private ToolContext toolContext;
}
