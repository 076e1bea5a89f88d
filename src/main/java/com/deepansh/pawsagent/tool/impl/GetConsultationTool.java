package com.deepansh.pawsagent.tool.impl;

import com.deepansh.pawsagent.config.ToolProperties;
import com.deepansh.pawsagent.exception.RecordRejectedException;
import com.deepansh.pawsagent.records.ConsultationRecord;
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
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Full detail of the sender's consultations.
 *
 * With an {@code id}, returns that consultation if it belongs to one of the sender's
 * pets. Otherwise fetches every consultation of the (optionally name-filtered) pets
 * and keeps those matching all given criteria: chief complaint and diagnosis by
 * case-insensitive substring, date by substring of its UTC {@code yyyy-MM-dd}.
 * A single match is returned as-is, several as a list.
 */
@Component
@Slf4j
public class GetConsultationTool implements ToolHandler<GetConsultationTool.Input> {

    private static final ToolPolicy POLICY = ToolPolicy.of(Duration.ofSeconds(10), 2, Duration.ofSeconds(2));

    static final String NO_PETS = "No se encontraron mascotas registradas";
    static final String NOT_FOUND = "Consulta no encontrada";
    static final String NOT_OWNED = "La consulta no pertenece a tus mascotas";
    static final String NO_MATCH = "No se encontraron consultas que coincidan con los criterios de búsqueda";

    private final PetRecordsGateway gateway;
    private final ToolProperties toolProperties;

    public GetConsultationTool(PetRecordsGateway gateway, ToolProperties toolProperties) {
        this.gateway = gateway;
        this.toolProperties = toolProperties;
    }

    @Data
    public static class Input {
        private String id;
        private String petName;
        private String chiefComplaint;
        private String diagnosis;
        private String date;
    }

    @Override
    public String getName() {
        return "get_consultation";
    }

    @Override
    public String getDescription() {
        return "Get detailed consultation information. Can search by ID, pet name, chief complaint, diagnosis, or date.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "id", Map.of("type", "string", "description", "Specific consultation ID"),
                        "petName", Map.of("type", "string",
                                "description", "Pet name to filter consultations (case insensitive)"),
                        "chiefComplaint", Map.of("type", "string",
                                "description", "Search consultations by chief complaint keywords"),
                        "diagnosis", Map.of("type", "string",
                                "description", "Search consultations by diagnosis keywords"),
                        "date", Map.of("type", "string",
                                "description", "Search by date (YYYY-MM-DD or partial date)")
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
            if (input.getId() != null && !input.getId().isBlank()) {
                return byId(input.getId().trim(), phone, context);
            }
            return search(input, phone, context);
        } catch (RecordRejectedException e) {
            return ToolResult.failure(e.getMessage());
        }
    }

    private ToolResult byId(String id, String phone, ToolContext context) {
        Optional<ConsultationRecord> consultation = gateway.getConsultation(id);
        if (consultation.isEmpty()) {
            return ToolResult.failure(NOT_FOUND);
        }

        List<PetRecord> pets = gateway.listPetsByOwnerPhone(phone);
        if (pets.isEmpty()) {
            return ToolResult.failure(NO_PETS);
        }
        Optional<PetRecord> owner = pets.stream()
                .filter(pet -> pet.getId() != null && pet.getId().equals(consultation.get().getPetId()))
                .findFirst();
        if (owner.isEmpty()) {
            log.warn("[{}] Consultation {} requested by {} belongs to another owner", context.requestId(), id, phone);
            return ToolResult.failure(NOT_OWNED);
        }

        log.info("[{}] Retrieved consultation {}", context.requestId(), id);
        return ToolResult.success(PetConsultation.of(consultation.get(), owner.get()));
    }

    private ToolResult search(Input input, String phone, ToolContext context) {
        List<PetRecord> pets = gateway.listPetsByOwnerPhone(phone);
        if (pets.isEmpty()) {
            return ToolResult.failure(NO_PETS);
        }

        List<PetRecord> targets = ListConsultationsTool.filterByName(pets, input.getPetName());
        if (targets.isEmpty()) {
            return ToolResult.failure("No se encontró ninguna mascota con el nombre \"" + input.getPetName() + "\"");
        }

        List<PetConsultation> matches = new ArrayList<>();
        for (PetRecord pet : targets) {
            for (ConsultationRecord summary : gateway.listConsultations(pet.getId())) {
                gateway.getConsultation(summary.getId())
                        .filter(detail -> matches(detail, input))
                        .ifPresent(detail -> matches.add(PetConsultation.of(detail, pet)));
            }
        }

        if (matches.isEmpty()) {
            return ToolResult.failure(NO_MATCH);
        }
        matches.sort(PetConsultation.NEWEST_FIRST);
        log.info("[{}] Found {} consultations matching search criteria", context.requestId(), matches.size());

        if (matches.size() == 1) {
            return ToolResult.success(matches.get(0));
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("consultations", matches);
        data.put("totalCount", matches.size());
        data.put("message", "Se encontraron " + matches.size() + " consultas");
        return ToolResult.success(data);
    }

    static boolean matches(ConsultationRecord consultation, Input input) {
        if (!containsIgnoreCase(consultation.getChiefComplaint(), input.getChiefComplaint())) {
            return false;
        }
        if (!containsIgnoreCase(consultation.getDiagnosis(), input.getDiagnosis())) {
            return false;
        }
        if (input.getDate() != null && !input.getDate().isBlank()) {
            if (consultation.getDate() == null) {
                return false;
            }
            String day = consultation.getDate().atOffset(ZoneOffset.UTC).toLocalDate().toString();
            return day.contains(input.getDate().trim());
        }
        return true;
    }

    /** A blank criterion matches anything; a set one never matches a missing field. */
    private static boolean containsIgnoreCase(String field, String criterion) {
        if (criterion == null || criterion.isBlank()) {
            return true;
        }
        return field != null && field.toLowerCase(Locale.ROOT).contains(criterion.trim().toLowerCase(Locale.ROOT));
    }
}
