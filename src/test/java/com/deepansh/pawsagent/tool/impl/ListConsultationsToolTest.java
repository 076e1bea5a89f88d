package com.deepansh.pawsagent.tool.impl;

import com.deepansh.pawsagent.config.ToolProperties;
import com.deepansh.pawsagent.exception.RecordRejectedException;
import com.deepansh.pawsagent.exception.TransientExternalException;
import com.deepansh.pawsagent.records.ConsultationRecord;
import com.deepansh.pawsagent.records.PetConsultation;
import com.deepansh.pawsagent.records.PetRecord;
import com.deepansh.pawsagent.records.PetRecordsGateway;
import com.deepansh.pawsagent.records.Species;
import com.deepansh.pawsagent.tool.ToolContext;
import com.deepansh.pawsagent.tool.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ListConsultationsToolTest {

    private static final ToolContext CONTEXT = new ToolContext("req-1", "whatsapp:+5491122334455", null);
    private static final String PHONE = "+5491122334455";

    private static final PetRecord LUNA = PetRecord.builder().id("p1").name("Luna").species(Species.CAT).build();
    private static final PetRecord ROCKY = PetRecord.builder().id("p2").name("Rocky").species(Species.DOG).build();

    @Mock PetRecordsGateway gateway;

    private ToolProperties props;
    private ListConsultationsTool tool;

    @BeforeEach
    void setUp() {
        props = new ToolProperties();
        tool = new ListConsultationsTool(gateway, props);
    }

    @Test
    void execute_allPets_newestFirstWithPetLabels() {
        when(gateway.listPetsByOwnerPhone(PHONE)).thenReturn(List.of(LUNA, ROCKY));
        when(gateway.listConsultations("p1")).thenReturn(List.of(
                consultation("c1", "p1", "2024-01-10T10:00:00Z"),
                consultation("c3", "p1", "2024-06-01T09:00:00Z")));
        when(gateway.listConsultations("p2")).thenReturn(List.of(
                consultation("c2", "p2", "2024-03-15T12:00:00Z")));

        ToolResult result = tool.execute(new ListConsultationsTool.Input(), CONTEXT);

        assertThat(result.ok()).isTrue();
        Map<String, Object> data = data(result);
        assertThat(data).containsEntry("totalCount", 3);
        assertThat(consultations(data))
                .extracting(c -> c.getConsultation().getId())
                .containsExactly("c3", "c2", "c1");
        assertThat(consultations(data).get(1).getPetName()).isEqualTo("Rocky");
        assertThat(consultations(data).get(1).getPetSpecies()).isEqualTo(Species.DOG);
        assertThat((List<?>) data.get("petsIncluded")).hasSize(2);
    }

    @Test
    void execute_petNameFilter_caseInsensitiveSubstring() {
        when(gateway.listPetsByOwnerPhone(PHONE)).thenReturn(List.of(LUNA, ROCKY));
        when(gateway.listConsultations("p2")).thenReturn(List.of(
                consultation("c2", "p2", "2024-03-15T12:00:00Z")));

        ListConsultationsTool.Input input = new ListConsultationsTool.Input();
        input.setPetName("rock");
        ToolResult result = tool.execute(input, CONTEXT);

        assertThat(consultations(data(result))).extracting(PetConsultation::getPetName).containsExactly("Rocky");
        verify(gateway, never()).listConsultations("p1");
    }

    @Test
    void execute_unknownPetName_failsWithName() {
        when(gateway.listPetsByOwnerPhone(PHONE)).thenReturn(List.of(LUNA));

        ListConsultationsTool.Input input = new ListConsultationsTool.Input();
        input.setPetName("Michi");

        assertThat(tool.execute(input, CONTEXT))
                .isEqualTo(ToolResult.failure("No se encontró ninguna mascota con el nombre \"Michi\""));
    }

    @Test
    void execute_noPets_failsWithoutConsultationLookups() {
        when(gateway.listPetsByOwnerPhone(PHONE)).thenReturn(List.of());

        assertThat(tool.execute(new ListConsultationsTool.Input(), CONTEXT))
                .isEqualTo(ToolResult.failure(ListConsultationsTool.NO_PETS));
        verify(gateway, never()).listConsultations(anyString());
    }

    @Test
    void execute_undatedConsultation_sortedLast() {
        when(gateway.listPetsByOwnerPhone(PHONE)).thenReturn(List.of(LUNA));
        when(gateway.listConsultations("p1")).thenReturn(List.of(
                ConsultationRecord.builder().id("c0").petId("p1").build(),
                consultation("c1", "p1", "2024-01-10T10:00:00Z")));

        ToolResult result = tool.execute(new ListConsultationsTool.Input(), CONTEXT);

        assertThat(consultations(data(result))).extracting(c -> c.getConsultation().getId())
                .containsExactly("c1", "c0");
    }

    @Test
    void execute_rejected_returnsFailure() {
        when(gateway.listPetsByOwnerPhone(PHONE)).thenThrow(new RecordRejectedException(403, "forbidden"));

        assertThat(tool.execute(new ListConsultationsTool.Input(), CONTEXT))
                .isEqualTo(ToolResult.failure("forbidden"));
    }

    @Test
    void execute_serviceDown_propagatesForRetry() {
        when(gateway.listPetsByOwnerPhone(PHONE)).thenReturn(List.of(LUNA));
        when(gateway.listConsultations("p1")).thenThrow(new TransientExternalException("Records service error 503"));

        assertThatThrownBy(() -> tool.execute(new ListConsultationsTool.Input(), CONTEXT))
                .isInstanceOf(TransientExternalException.class);
    }

    @Test
    void isEnabled_onlyWithRecordsService() {
        assertThat(tool.isEnabled()).isFalse();

        props.getRecords().setBaseUrl("http://records.test/api");

        assertThat(tool.isEnabled()).isTrue();
        assertThat(tool.getPolicy()).hasValueSatisfying(policy -> {
            assertThat(policy.retries()).isEqualTo(2);
            assertThat(policy.timeout().toMillis()).isEqualTo(8_000);
            assertThat(policy.retryDelay().toMillis()).isEqualTo(1_500);
        });
    }

    private static ConsultationRecord consultation(String id, String petId, String date) {
        return ConsultationRecord.builder()
                .id(id)
                .petId(petId)
                .consultationType("CONTROL")
                .date(Instant.parse(date))
                .build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> data(ToolResult result) {
        return (Map<String, Object>) result.data();
    }

    @SuppressWarnings("unchecked")
    private static List<PetConsultation> consultations(Map<String, Object> data) {
        return (List<PetConsultation>) data.get("consultations");
    }
}
