package com.deepansh.pawsagent.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Entry of the per-identity conversation log.
 *
 * Stored shape: {@code {"role":"user","text":...}},
 * {@code {"role":"assistant","content":[...]}} or
 * {@code {"role":"tool_results","content":[...]}}.
 * Only a {@link UserMessage} starts a new turn.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "role")
@JsonSubTypes({
        @JsonSubTypes.Type(value = UserMessage.class, name = "user"),
        @JsonSubTypes.Type(value = AssistantMessage.class, name = "assistant"),
        @JsonSubTypes.Type(value = ToolResultMessage.class, name = "tool_results")
})
public abstract class SessionMessage {

    public boolean startsTurn() {
        return false;
    }
}
