package com.deepansh.pawsagent.tool.impl;

import com.deepansh.pawsagent.config.ToolProperties;
import com.deepansh.pawsagent.exception.RecordRejectedException;
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
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class ListPetsTool implements ToolHandler<NoInput> {

    private static final ToolPolicy POLICY = ToolPolicy.of(Duration.ofSeconds(5), 2, Duration.ofSeconds(1));

    private final PetRecordsGateway gateway;
    private final ToolProperties toolProperties;

    public ListPetsTool(PetRecordsGateway gateway, ToolProperties toolProperties) {
        this.gateway = gateway;
        this.toolProperties = toolProperties;
    }

    @Override
    public String getName() {
        return "list_pets";
    }

    @Override
    public String getDescription() {
        return "List all pets owned by a user when they ask about their pets.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(),
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
        try {
            List<PetRecord> pets = gateway.listPetsByOwnerPhone(phone);
            log.info("[{}] Listed {} pets for {}", context.requestId(), pets.size(), phone);
            return ToolResult.success(pets);
        } catch (RecordRejectedException e) {
            return ToolResult.failure(e.getMessage());
        }
    }
}
