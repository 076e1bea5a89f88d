package com.deepansh.pawsagent.tool.impl;

import com.deepansh.pawsagent.config.ToolProperties;
import com.deepansh.pawsagent.exception.RecordRejectedException;
import com.deepansh.pawsagent.records.PetConsultation;
import com.deepansh.pawsagent.records.PetRecord;
import com.deepansh.pawsagent.records.PetRecordsGateway;
import com.deepansh.pawsagent.session.IdentityNormalizer;
import com.deepansh.pawsagent.tool.ToolContext;
import com.deepansh.pawsagent.tool.ToolHandler;
import com.deepansh.pawsagent.tool.ToolPolicy;
import com.deepansh.pawsagent.tool.ToolResult;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lists the consultations of the sender's pets, newest first, optionally narrowed to
 * pets whose name contains {@code petName}.
 */
@Component
@Slf4j
public class ListConsultationsTool implements ToolHandler<ListConsultationsTool.Input> {

    private static final ToolPolicy POLICY = ToolPolicy.of(Duration.ofSeconds(8), 2, Duration.ofMillis(1500));

    static final String NO_PETS = "No se encontraron mascotas registradas para este usuario";

    private final PetRecordsGateway gateway;
    private final ToolProperties toolProperties;

    public ListConsultationsTool(PetRecordsGateway gateway, ToolProperties toolProperties) {
        this.gateway = gateway;
        this.toolProperties = toolProperties;
    }

    @Data
    public static class Input {
        private String petName;
    }

    @Override
    public String getName() {
        return "list_consultations";
    }

    @Override
    public String getDescription() {
        return "List consultations for user pets, optionally filtered by pet name.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "petName", Map.of(
                                "type", "string",
                                "description", "Optional pet name to filter consultations (case insensitive)")
                ),
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
            List<PetRecord> pets = gateway.listPetsByOwnerPhone(phone);
            if (pets.isEmpty()) {
                return ToolResult.failure(NO_PETS);
            }

            List<PetRecord> targets = filterByName(pets, input.getPetName());
            if (targets.isEmpty()) {
                return ToolResult.failure("No se encontró ninguna mascota con el nombre \"" + input.getPetName() + "\"");
            }

            List<PetConsultation> consultations = new ArrayList<>();
            for (PetRecord pet : targets) {
                gateway.listConsultations(pet.getId())
                        .forEach(c -> consultations.add(PetConsultation.of(c, pet)));
            }
            consultations.sort(PetConsultation.NEWEST_FIRST);

            log.info("[{}] Listed {} consultations for {} pets", context.requestId(), consultations.size(), targets.size());

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("consultations", consultations);
            data.put("totalCount", consultations.size());
            data.put("petsIncluded", targets.stream().map(ListConsultationsTool::petSummary).toList());
            return ToolResult.success(data);
        } catch (RecordRejectedException e) {
            return ToolResult.failure(e.getMessage());
        }
    }

    /** Pets whose name contains {@code petName}, ignoring case; all pets when it is blank. */
    static List<PetRecord> filterByName(List<PetRecord> pets, String petName) {
        if (petName == null || petName.isBlank()) {
            return pets;
        }
        String needle = petName.trim().toLowerCase(Locale.ROOT);
        return pets.stream()
                .filter(pet -> pet.getName() != null && pet.getName().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
    }

    private static Map<String, Object> petSummary(PetRecord pet) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", pet.getId());
        summary.put("name", pet.getName());
        summary.put("species", pet.getSpecies());
        return summary;
    }
}
