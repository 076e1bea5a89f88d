package com.deepansh.pawsagent.tool.impl;

import com.deepansh.pawsagent.config.ToolProperties;
import com.deepansh.pawsagent.exception.RecordRejectedException;
import com.deepansh.pawsagent.records.OwnerRecord;
import com.deepansh.pawsagent.records.PetRecord;
import com.deepansh.pawsagent.records.PetRecordsGateway;
import com.deepansh.pawsagent.session.IdentityNormalizer;
import com.deepansh.pawsagent.tool.NoInput;
import com.deepansh.pawsagent.tool.ToolContext;
import com.deepansh.pawsagent.tool.ToolHandler;
import com.deepansh.pawsagent.tool.ToolPolicy;
import com.deepansh.pawsagent.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class GetUserInfoTool implements ToolHandler<NoInput> {

    static final String NOT_FOUND = "Usuario no encontrado. ¿Te gustaría registrarte primero?";

    private static final ToolPolicy POLICY = ToolPolicy.of(Duration.ofSeconds(5), 2, Duration.ofSeconds(1));

    private final PetRecordsGateway gateway;
    private final ToolProperties toolProperties;

    public GetUserInfoTool(PetRecordsGateway gateway, ToolProperties toolProperties) {
        this.gateway = gateway;
        this.toolProperties = toolProperties;
    }

    @Override
    public String getName() {
        return "get_user_info";
    }

    @Override
    public String getDescription() {
        return "Get user information including their name and basic details when they ask questions about themselves.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(),
                "required", List.of(),
                "additionalProperties", false
        );
    }

    @Override
    public Class<NoInput> getInputType() {
        return NoInput.class;
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
    public ToolResult execute(NoInput input, ToolContext context) {
        String phone = IdentityNormalizer.normalize(context.identity());

        Optional<OwnerRecord> owner;
        try {
            owner = gateway.findOwnerByPhone(phone);
        } catch (RecordRejectedException e) {
            return ToolResult.failure(e.getMessage());
        }
        if (owner.isEmpty()) {
            return ToolResult.failure(NOT_FOUND);
        }

        List<PetRecord> pets;
        try {
            pets = gateway.listPetsByOwnerPhone(phone);
        } catch (RecordRejectedException e) {
            log.warn("[{}] Could not list pets for user info: {}", context.requestId(), e.getMessage());
            pets = List.of();
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user", owner.get());
        data.put("pets", pets);
        log.info("[{}] User info retrieved [pets={}]", context.requestId(), pets.size());
        return ToolResult.success(data);
    }
}
