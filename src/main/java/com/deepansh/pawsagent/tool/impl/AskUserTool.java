package com.deepansh.pawsagent.tool.impl;

import com.deepansh.pawsagent.tool.ToolContext;
import com.deepansh.pawsagent.tool.ToolHandler;
import com.deepansh.pawsagent.tool.ToolPolicy;
import com.deepansh.pawsagent.tool.ToolResult;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lets the model ask the user for missing details. No side effects: the question
 * is echoed back and the model phrases its reply around it.
 */
@Component
@Slf4j
public class AskUserTool implements ToolHandler<AskUserTool.Input> {

    private static final ToolPolicy POLICY = ToolPolicy.of(Duration.ofSeconds(1), 0, Duration.ZERO);

    @Data
    public static class Input {
        @NotBlank(message = "Message is required")
        private String message;
    }

    @Override
    public String getName() {
        return "ask_user";
    }

    @Override
    public String getDescription() {
        return "Ask the user for missing information or clarification.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "message", Map.of(
                                "type", "string",
                                "description", "Clarification question in Spanish"
                        )
                ),
                "required", List.of("message"),
                "additionalProperties", false
        );
    }

    @Override
    public Class<Input> getInputType() {
        return Input.class;
    }

    @Override
    public Optional<ToolPolicy> getPolicy() {
        return Optional.of(POLICY);
    }

    @Override
    public ToolResult execute(Input input, ToolContext context) {
        log.info("[{}] Asking user: {}", context.requestId(), input.getMessage());
        return ToolResult.success(Map.of("message", input.getMessage()));
    }
}
