package com.deepansh.pawsagent.tool;

/**
 * Structured outcome of a tool call, serialized as the content of a tool_result block.
 * {@code ok=false} results are final answers, not errors to retry.
 */
public record ToolResult(boolean ok, Object data, String error) {

    public static final String UNAVAILABLE = "Tool result unavailable";

    public static ToolResult success(Object data) {
        return new ToolResult(true, data, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error);
    }

    public static ToolResult unavailable() {
        return failure(UNAVAILABLE);
    }
}
