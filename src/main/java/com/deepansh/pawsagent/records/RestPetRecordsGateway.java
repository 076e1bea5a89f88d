package com.deepansh.pawsagent.records;

import com.deepansh.pawsagent.config.ToolProperties;
import com.deepansh.pawsagent.exception.RecordRejectedException;
import com.deepansh.pawsagent.exception.TransientExternalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * REST adapter for the pet records service.
 *
 * Endpoints:
 * - GET  /users/by-phone/{phone}
 * - POST /users                        {name, phone}
 * - GET  /users/by-phone/{phone}/pets
 * - POST /pets                         {name, species, dateOfBirth, ownerPhone}
 * - GET  /pets/{petId}/consultations
 * - GET  /consultations/{id}
 *
 * Status mapping: 404 on lookups → empty; other 4xx → RecordRejectedException;
 * 5xx and I/O errors → TransientExternalException (retried by the ToolRunner).
 */
@Component
@Slf4j
public class RestPetRecordsGateway implements PetRecordsGateway {

    private static final int MAX_ERROR_BODY = 300;

    private final RestClient restClient;

    public RestPetRecordsGateway(RestClient.Builder restClientBuilder, ToolProperties toolProperties) {
        ToolProperties.Records records = toolProperties.getRecords();
        RestClient.Builder builder = restClientBuilder.clone()
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (records.isConfigured()) {
            builder.baseUrl(records.getBaseUrl());
        }
        if (records.getApiToken() != null && !records.getApiToken().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + records.getApiToken());
        }
        this.restClient = builder.build();
    }

    @Override
    public Optional<OwnerRecord> findOwnerByPhone(String phone) {
        try {
            OwnerRecord owner = call("find owner", () -> restClient.get()
                    .uri("/users/by-phone/{phone}", phone)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::translateError)
                    .body(OwnerRecord.class));
            return Optional.ofNullable(owner);
        } catch (RecordRejectedException e) {
            if (e.getStatus() == 404) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public OwnerRecord registerOwner(String name, String phone) {
        log.info("Registering owner [phone={}]", phone);
        return call("register owner", () -> restClient.post()
                .uri("/users")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("name", name, "phone", phone))
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::translateError)
                .body(OwnerRecord.class));
    }

    @Override
    public List<PetRecord> listPetsByOwnerPhone(String phone) {
        try {
            List<PetRecord> pets = call("list pets", () -> restClient.get()
                    .uri("/users/by-phone/{phone}/pets", phone)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::translateError)
                    .body(new ParameterizedTypeReference<List<PetRecord>>() {}));
            return pets != null ? pets : List.of();
        } catch (RecordRejectedException e) {
            if (e.getStatus() == 404) {
                return List.of();
            }
            throw e;
        }
    }

    @Override
    public PetRecord createPet(String name, Species species, LocalDate dateOfBirth, String ownerPhone) {
        log.info("Creating pet [name={}, species={}, owner={}]", name, species, ownerPhone);
        return call("create pet", () -> restClient.post()
                .uri("/pets")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of(
                        "name", name,
                        "species", species.name(),
                        "dateOfBirth", dateOfBirth.toString(),
                        "ownerPhone", ownerPhone))
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::translateError)
                .body(PetRecord.class));
    }

    @Override
    public List<ConsultationRecord> listConsultations(String petId) {
        try {
            List<ConsultationRecord> consultations = call("list consultations", () -> restClient.get()
                    .uri("/pets/{petId}/consultations", petId)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::translateError)
                    .body(new ParameterizedTypeReference<List<ConsultationRecord>>() {}));
            return consultations != null ? consultations : List.of();
        } catch (RecordRejectedException e) {
            if (e.getStatus() == 404) {
                return List.of();
            }
            throw e;
        }
    }

    @Override
    public Optional<ConsultationRecord> getConsultation(String consultationId) {
        try {
            ConsultationRecord consultation = call("get consultation", () -> restClient.get()
                    .uri("/consultations/{id}", consultationId)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::translateError)
                    .body(ConsultationRecord.class));
            return Optional.ofNullable(consultation);
        } catch (RecordRejectedException e) {
            if (e.getStatus() == 404) {
                return Optional.empty();
            }
            throw e;
        }
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (ResourceAccessException e) {
            throw new TransientExternalException("Records service unreachable (" + operation + "): "
                    + e.getMessage(), e);
        }
    }

    private void translateError(HttpRequest request, ClientHttpResponse response)
            throws IOException {
        int status = response.getStatusCode().value();
        String body = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
        if (body.length() > MAX_ERROR_BODY) {
            body = body.substring(0, MAX_ERROR_BODY);
        }
        log.warn("Records service returned {} for {} {}: {}", status, request.getMethod(), request.getURI(), body);

        if (response.getStatusCode().is5xxServerError() || status == 429) {
            throw new TransientExternalException("Records service error " + status);
        }
        throw new RecordRejectedException(status, body.isBlank() ? "Records service returned " + status : body);
    }
}
