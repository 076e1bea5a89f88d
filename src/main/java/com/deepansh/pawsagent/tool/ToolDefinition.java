package com.deepansh.pawsagent.tool;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Immutable snapshot of a tool's schema sent to the model.
 * Decouples the wire format from the ToolHandler implementation.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;

    public static ToolDefinition from(ToolHandler<?> handler) {
        return ToolDefinition.builder()
                .name(handler.getName())
                .description(handler.getDescription())
                .inputSchema(handler.getInputSchema())
                .build();
    }

    /**
     * Messages API tool format: { "name", "description", "input_schema" }
     */
    public Map<String, Object> toWireSchema() {
        return Map.of(
                "name", name,
                "description", description,
                "input_schema", inputSchema
        );
    }
}
