package com.deepansh.pawsagent.tool.impl;

import com.deepansh.pawsagent.config.ToolProperties;
import com.deepansh.pawsagent.exception.RecordRejectedException;
import com.deepansh.pawsagent.records.InputNormalizer;
import com.deepansh.pawsagent.records.OwnerRecord;
import com.deepansh.pawsagent.records.PetRecordsGateway;
import com.deepansh.pawsagent.session.IdentityNormalizer;
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
 * Registers the sender as an owner, or renames an existing one. The phone always
 * comes from the conversation identity, never from model input.
 */
@Component
@Slf4j
public class RegisterUserTool implements ToolHandler<RegisterUserTool.Input> {

    private static final ToolPolicy POLICY = ToolPolicy.of(Duration.ofSeconds(5), 2, Duration.ofSeconds(1));

    private final PetRecordsGateway gateway;
    private final InputNormalizer normalizer;
    private final ToolProperties toolProperties;

    public RegisterUserTool(PetRecordsGateway gateway, InputNormalizer normalizer, ToolProperties toolProperties) {
        this.gateway = gateway;
        this.normalizer = normalizer;
        this.toolProperties = toolProperties;
    }

    @Data
    public static class Input {
        @NotBlank(message = "Name is required")
        private String name;
    }

    @Override
    public String getName() {
        return "register_user";
    }

    @Override
    public String getDescription() {
        return "Register or update a user when they provide their name.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "name", Map.of("type", "string", "description", "User full name")
                ),
                "required", List.of("name"),
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
    public boolean isEnabled() {
        return toolProperties.getRecords().isConfigured();
    }

    @Override
    public ToolResult execute(Input input, ToolContext context) {
        String phone = IdentityNormalizer.normalize(context.identity());
        try {
            OwnerRecord owner = gateway.registerOwner(normalizer.normalizeName(input.getName()), phone);
            log.info("[{}] User registered/updated: {}", context.requestId(), owner.getId());
            return ToolResult.success(owner);
        } catch (RecordRejectedException e) {
            log.warn("[{}] Register user rejected: {}", context.requestId(), e.getMessage());
            return ToolResult.failure(e.getMessage());
        }
    }
}
