package com.deepansh.pawsagent.tool.impl;

import com.deepansh.pawsagent.config.ToolProperties;
import com.deepansh.pawsagent.exception.RecordRejectedException;
import com.deepansh.pawsagent.records.InputNormalizer;
import com.deepansh.pawsagent.records.OwnerRecord;
import com.deepansh.pawsagent.records.PetRecordsGateway;
import com.deepansh.pawsagent.tool.ToolContext;
import com.deepansh.pawsagent.tool.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegisterUserToolTest {

    private static final ToolContext CONTEXT = new ToolContext("req-1", "whatsapp:+54 9 11 2233 4455", "SM1");

    @Mock PetRecordsGateway gateway;

    private RegisterUserTool tool;

    @BeforeEach
    void setUp() {
        ToolProperties props = new ToolProperties();
        props.getRecords().setBaseUrl("http://records.test/api");
        tool = new RegisterUserTool(gateway, new InputNormalizer(), props);
    }

    @Test
    void execute_phoneComesFromIdentity_nameIsNormalized() {
        OwnerRecord owner = new OwnerRecord("u1", "Ana María", "+5491122334455");
        when(gateway.registerOwner("Ana María", "+5491122334455")).thenReturn(owner);

        RegisterUserTool.Input input = new RegisterUserTool.Input();
        input.setName("ana maría");

        assertThat(tool.execute(input, CONTEXT)).isEqualTo(ToolResult.success(owner));
    }

    @Test
    void execute_serviceRejects_returnsFailure() {
        when(gateway.registerOwner("Ana", "+5491122334455"))
                .thenThrow(new RecordRejectedException(422, "Invalid phone"));

        RegisterUserTool.Input input = new RegisterUserTool.Input();
        input.setName("Ana");

        assertThat(tool.execute(input, CONTEXT)).isEqualTo(ToolResult.failure("Invalid phone"));
    }

    @Test
    void inputSchema_requiresName() {
        assertThat(tool.getName()).isEqualTo("register_user");
        assertThat(tool.getInputSchema().get("required").toString()).contains("name");
    }
}
