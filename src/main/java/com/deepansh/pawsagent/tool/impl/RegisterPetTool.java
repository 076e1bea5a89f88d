package com.deepansh.pawsagent.tool.impl;

import com.deepansh.pawsagent.config.ToolProperties;
import com.deepansh.pawsagent.exception.RecordRejectedException;
import com.deepansh.pawsagent.records.InputNormalizer;
import com.deepansh.pawsagent.records.PetRecord;
import com.deepansh.pawsagent.records.PetRecordsGateway;
import com.deepansh.pawsagent.records.Species;
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
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registers a pet for the sender.
 *
 * Input is normalized first (Spanish species words, free-form dates, name casing).
 * A pet with the same name and species already on file is returned as-is instead of
 * being created twice, so a retried call that reached the service is harmless.
 */
@Component
@Slf4j
public class RegisterPetTool implements ToolHandler<RegisterPetTool.Input> {

    static final String ALREADY_REGISTERED = "Esta mascota ya estaba registrada";
    static final String INVALID_SPECIES = "Especie de mascota no reconocida. Debe ser \"perro\" o \"gato\".";
    static final String INVALID_DATE =
            "Fecha no válida. Proporciona una fecha específica como \"15 de enero de 2022\".";

    private static final ToolPolicy POLICY = ToolPolicy.of(Duration.ofSeconds(8), 2, Duration.ofMillis(1500));

    private final PetRecordsGateway gateway;
    private final InputNormalizer normalizer;
    private final ToolProperties toolProperties;

    public RegisterPetTool(PetRecordsGateway gateway, InputNormalizer normalizer, ToolProperties toolProperties) {
        this.gateway = gateway;
        this.normalizer = normalizer;
        this.toolProperties = toolProperties;
    }

    @Data
    public static class Input {
        @NotBlank(message = "Pet name is required")
        private String name;

        @NotBlank(message = "Date of birth is required")
        private String dateOfBirth;

        @NotBlank(message = "Species must be CAT or DOG")
        private String species;
    }

    @Override
    public String getName() {
        return "register_pet";
    }

    @Override
    public String getDescription() {
        return "Register a new pet. Only call if you have clear name and species.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "name", Map.of("type", "string", "description", "Pet name"),
                        "dateOfBirth", Map.of("type", "string", "description", "Pet birth date in any clear format"),
                        "species", Map.of(
                                "type", "string",
                                "enum", List.of("CAT", "DOG"),
                                "description", "Must be exactly CAT or DOG")
                ),
                "required", List.of("name", "dateOfBirth", "species"),
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
        String name = normalizer.normalizeName(input.getName());

        Species species;
        try {
            species = normalizer.normalizeSpecies(input.getSpecies());
        } catch (IllegalArgumentException e) {
            log.warn("[{}] {}", context.requestId(), e.getMessage());
            return ToolResult.failure(INVALID_SPECIES);
        }

        LocalDate dateOfBirth;
        try {
            dateOfBirth = normalizer.normalizeDate(input.getDateOfBirth());
        } catch (IllegalArgumentException e) {
            log.warn("[{}] {}", context.requestId(), e.getMessage());
            return ToolResult.failure(INVALID_DATE);
        }

        try {
            Optional<PetRecord> duplicate = gateway.listPetsByOwnerPhone(phone).stream()
                    .filter(pet -> pet.getName() != null && pet.getName().equalsIgnoreCase(name))
                    .filter(pet -> pet.getSpecies() == species)
                    .findFirst();
            if (duplicate.isPresent()) {
                log.info("[{}] Pet already exists: {}", context.requestId(), duplicate.get().getId());
                return ToolResult.success(describe(duplicate.get(), ALREADY_REGISTERED));
            }

            PetRecord created = gateway.createPet(name, species, dateOfBirth, phone);
            log.info("[{}] Pet registered: {}", context.requestId(), created.getId());
            return ToolResult.success(created);
        } catch (RecordRejectedException e) {
            log.warn("[{}] Register pet rejected: {}", context.requestId(), e.getMessage());
            return ToolResult.failure(e.getMessage());
        }
    }

    private static Map<String, Object> describe(PetRecord pet, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", pet.getId());
        data.put("name", pet.getName());
        data.put("species", pet.getSpecies());
        data.put("dateOfBirth", pet.getDateOfBirth() != null ? pet.getDateOfBirth().toString() : null);
        data.put("ownerPhone", pet.getOwnerPhone());
        data.put("message", message);
        return data;
    }
}
