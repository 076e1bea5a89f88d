package com.deepansh.pawsagent.transcode;

import com.deepansh.pawsagent.model.ContentBlock;
import com.deepansh.pawsagent.model.ToolResultBlock;
import com.deepansh.pawsagent.model.ToolUseBlock;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One entry of the request's {@code messages} array: role is "user" or "assistant".
 * Serialized as-is into the request body, so only the components are JSON properties.
 */
public record WireMessage(String role, List<ContentBlock> content) {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    @JsonIgnore
    public boolean isUser() {
        return USER.equals(role);
    }

    @JsonIgnore
    public boolean isAssistant() {
        return ASSISTANT.equals(role);
    }

    public boolean hasToolResults() {
        return content.stream().anyMatch(b -> b instanceof ToolResultBlock);
    }

    public Set<String> toolUseIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (ContentBlock block : content) {
            if (block instanceof ToolUseBlock) {
                ids.add(((ToolUseBlock) block).getId());
            }
        }
        return ids;
    }

    public Set<String> toolResultIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (ContentBlock block : content) {
            if (block instanceof ToolResultBlock) {
                ids.add(((ToolResultBlock) block).getToolUseId());
            }
        }
        return ids;
    }
}
