package com.deepansh.pawsagent.tool.impl;

import com.deepansh.pawsagent.config.ToolProperties;
import com.deepansh.pawsagent.exception.RecordRejectedException;
import com.deepansh.pawsagent.records.InputNormalizer;
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

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegisterPetToolTest {

    private static final String PHONE = "+5491122334455";
    private static final ToolContext CONTEXT = new ToolContext("req-1", "whatsapp:" + PHONE, "SM1");

    @Mock PetRecordsGateway gateway;

    private ToolProperties props;
    private RegisterPetTool tool;

    @BeforeEach
    void setUp() {
        props = new ToolProperties();
        props.getRecords().setBaseUrl("http://records.test/api");
        tool = new RegisterPetTool(gateway, new InputNormalizer(), props);
    }

    @Test
    void execute_newPet_createsWithNormalizedInput() {
        PetRecord created = PetRecord.builder().id("p1").name("Luna De Miel").species(Species.CAT)
                .dateOfBirth(LocalDate.of(2022, 1, 15)).ownerPhone(PHONE).build();
        when(gateway.listPetsByOwnerPhone(PHONE)).thenReturn(List.of());
        when(gateway.createPet("Luna De Miel", Species.CAT, LocalDate.of(2022, 1, 15), PHONE)).thenReturn(created);

        ToolResult result = tool.execute(input("  luna de   MIEL", "15 de enero de 2022", "gatito"), CONTEXT);

        assertThat(result).isEqualTo(ToolResult.success(created));
    }

    @Test
    void execute_samePetAlreadyOnFile_returnsExistingWithoutCreating() {
        PetRecord existing = PetRecord.builder().id("p1").name("Rocky").species(Species.DOG)
                .dateOfBirth(LocalDate.of(2020, 5, 1)).ownerPhone(PHONE).build();
        when(gateway.listPetsByOwnerPhone(PHONE)).thenReturn(List.of(existing));

        ToolResult result = tool.execute(input("rocky", "2020-05-01", "perro"), CONTEXT);

        assertThat(result.ok()).isTrue();
        assertThat(data(result))
                .containsEntry("id", "p1")
                .containsEntry("message", RegisterPetTool.ALREADY_REGISTERED);
        verify(gateway, never()).createPet(any(), any(), any(), any());
    }

    @Test
    void execute_sameNameOtherSpecies_createsNewPet() {
        PetRecord cat = PetRecord.builder().id("p1").name("Rocky").species(Species.CAT).build();
        PetRecord dog = PetRecord.builder().id("p2").name("Rocky").species(Species.DOG).build();
        when(gateway.listPetsByOwnerPhone(PHONE)).thenReturn(List.of(cat));
        when(gateway.createPet("Rocky", Species.DOG, LocalDate.of(2020, 5, 1), PHONE)).thenReturn(dog);

        ToolResult result = tool.execute(input("Rocky", "01/05/2020", "DOG"), CONTEXT);

        assertThat(result).isEqualTo(ToolResult.success(dog));
    }

    @Test
    void execute_unknownSpecies_failsWithoutCallingService() {
        ToolResult result = tool.execute(input("Nemo", "2022-01-15", "pez"), CONTEXT);

        assertThat(result).isEqualTo(ToolResult.failure(RegisterPetTool.INVALID_SPECIES));
        verifyNoInteractions(gateway);
    }

    @Test
    void execute_unparseableDate_failsWithoutCallingService() {
        ToolResult result = tool.execute(input("Luna", "hace un tiempo", "gato"), CONTEXT);

        assertThat(result).isEqualTo(ToolResult.failure(RegisterPetTool.INVALID_DATE));
        verifyNoInteractions(gateway);
    }

    @Test
    void execute_serviceRejects_returnsFailure() {
        when(gateway.listPetsByOwnerPhone(PHONE)).thenReturn(List.of());
        when(gateway.createPet(any(), any(), any(), any()))
                .thenThrow(new RecordRejectedException(400, "Owner not registered"));

        ToolResult result = tool.execute(input("Luna", "2022-01-15", "CAT"), CONTEXT);

        assertThat(result).isEqualTo(ToolResult.failure("Owner not registered"));
    }

    @Test
    void isEnabled_followsRecordsConfiguration() {
        assertThat(tool.isEnabled()).isTrue();

        props.getRecords().setBaseUrl("");

        assertThat(tool.isEnabled()).isFalse();
    }

    @Test
    void policy_eightSecondsTwoRetries() {
        assertThat(tool.getPolicy()).hasValueSatisfying(policy -> {
            assertThat(policy.timeout()).hasSeconds(8);
            assertThat(policy.retries()).isEqualTo(2);
        });
    }

    private static RegisterPetTool.Input input(String name, String dateOfBirth, String species) {
        RegisterPetTool.Input input = new RegisterPetTool.Input();
        input.setName(name);
        input.setDateOfBirth(dateOfBirth);
        input.setSpecies(species);
        return input;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> data(ToolResult result) {
        return (Map<String, Object>) result.data();
    }
}
