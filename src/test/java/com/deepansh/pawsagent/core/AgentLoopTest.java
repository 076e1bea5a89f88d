package com.deepansh.pawsagent.core;

import com.deepansh.pawsagent.config.AgentProperties;
import com.deepansh.pawsagent.config.ToolProperties;
import com.deepansh.pawsagent.exception.TransientExternalException;
import com.deepansh.pawsagent.model.AssistantMessage;
import com.deepansh.pawsagent.model.InboundMessage;
import com.deepansh.pawsagent.model.SessionMessage;
import com.deepansh.pawsagent.model.ToolResultBlock;
import com.deepansh.pawsagent.model.ToolResultMessage;
import com.deepansh.pawsagent.model.UserMessage;
import com.deepansh.pawsagent.observability.RunContext;
import com.deepansh.pawsagent.observability.RunOutcome;
import com.deepansh.pawsagent.observability.TraceService;
import com.deepansh.pawsagent.records.PetRecord;
import com.deepansh.pawsagent.records.PetRecordsGateway;
import com.deepansh.pawsagent.records.Species;
import com.deepansh.pawsagent.testsupport.InMemorySessionStore;
import com.deepansh.pawsagent.testsupport.ScriptedModelClient;
import com.deepansh.pawsagent.tool.IdempotencyKeyGenerator;
import com.deepansh.pawsagent.tool.ToolInputValidator;
import com.deepansh.pawsagent.tool.ToolRegistry;
import com.deepansh.pawsagent.tool.ToolRunner;
import com.deepansh.pawsagent.tool.idempotency.InMemoryIdempotencyCache;
import com.deepansh.pawsagent.tool.impl.AskUserTool;
import com.deepansh.pawsagent.tool.impl.ListPetsTool;
import com.deepansh.pawsagent.transcode.MessageTranscoder;
import com.deepansh.pawsagent.transcode.WireMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static com.deepansh.pawsagent.testsupport.ScriptedModelClient.call;
import static com.deepansh.pawsagent.testsupport.ScriptedModelClient.text;
import static com.deepansh.pawsagent.testsupport.ScriptedModelClient.toolCalls;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentLoopTest {

    private static final String IDENTITY = "whatsapp:+5491122334455";
    private static final String PHONE = "+5491122334455";

    @Mock TraceService traceService;
    @Mock PetRecordsGateway gateway;

    private final AgentProperties properties = new AgentProperties();
    private InMemorySessionStore sessionStore;
    private ScriptedModelClient modelClient;
    private AgentLoop agentLoop;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
        ToolProperties toolProperties = new ToolProperties();
        toolProperties.getRecords().setBaseUrl("http://records.test/api");

        ToolRegistry registry = new ToolRegistry(List.of(
                new AskUserTool(),
                new ListPetsTool(gateway, toolProperties)));
        ToolRunner runner = new ToolRunner(
                new InMemoryIdempotencyCache(100),
                new ToolInputValidator(objectMapper, Validation.buildDefaultValidatorFactory().getValidator()),
                new IdempotencyKeyGenerator(),
                Runnable::run,
                properties);

        sessionStore = new InMemorySessionStore();
        modelClient = new ScriptedModelClient();
        agentLoop = new AgentLoop(sessionStore, new MessageTranscoder(), modelClient, registry, runner,
                traceService, objectMapper, properties, Runnable::run);
    }

    @Test
    void handle_textReply_persistsUserAndAssistantTurn() {
        modelClient.reply(text("¡Hola! ¿En qué te ayudo?"));

        String reply = agentLoop.handle(inbound("hola", "SM1"));

        assertThat(reply).isEqualTo("¡Hola! ¿En qué te ayudo?");
        assertThat(sessionStore.messages(IDENTITY)).hasSize(2);
        assertThat(sessionStore.messages(IDENTITY).get(0)).isEqualTo(new UserMessage("hola"));
        assertThat(lastTrace().getOutcome()).isEqualTo(RunOutcome.REPLIED);
        assertThat(modelClient.requests().get(0).tools()).hasSize(2);
    }

    @Test
    void handle_duplicateDelivery_answeredWithoutSideEffects() {
        modelClient.reply(text("Respuesta"));

        agentLoop.handle(inbound("hola", "SM1"));
        String second = agentLoop.handle(inbound("hola", "SM1"));

        assertThat(second).isEqualTo("Mensaje ya procesado.");
        assertThat(modelClient.callCount()).isEqualTo(1);
        assertThat(sessionStore.messages(IDENTITY)).hasSize(2);
    }

    @Test
    void handle_noInboundMessageId_neverTreatedAsDuplicate() {
        modelClient.reply(text("Respuesta"));

        agentLoop.handle(inbound("hola", null));
        agentLoop.handle(inbound("hola", null));

        assertThat(modelClient.callCount()).isEqualTo(2);
    }

    @Test
    void handle_terminationKeyword_endsSessionWithoutModelCall() {
        modelClient.reply(text("Respuesta"));
        agentLoop.handle(inbound("hola", "SM1"));

        String reply = agentLoop.handle(inbound("fin", "SM2"));

        assertThat(reply).isEqualTo("👋 Sesión terminada. ¡Hasta luego!");
        assertThat(modelClient.callCount()).isEqualTo(1);
        assertThat(sessionStore.endCount()).isEqualTo(1);
        assertThat(sessionStore.messages(IDENTITY)).isEmpty();
    }

    @Test
    void handle_toolCalls_oneResultPerCallInSingleBundle() {
        when(gateway.listPetsByOwnerPhone(PHONE)).thenReturn(List.of(
                PetRecord.builder().id("p1").name("Luna").species(Species.CAT)
                        .dateOfBirth(LocalDate.of(2022, 1, 15)).ownerPhone(PHONE).build()));
        modelClient
                .reply(toolCalls(
                        call("toolu_1", "list_pets", Map.of()),
                        call("toolu_2", "ask_user", Map.of("message", "¿Querés registrar otra?"))))
                .reply(text("Tenés a Luna. ¿Querés registrar otra?"));

        String reply = agentLoop.handle(inbound("¿qué mascotas tengo?", "SM1"));

        assertThat(reply).isEqualTo("Tenés a Luna. ¿Querés registrar otra?");
        List<SessionMessage> log = sessionStore.messages(IDENTITY);
        assertThat(log).hasSize(4);
        assertThat(log.get(1)).isInstanceOf(AssistantMessage.class);
        ToolResultMessage bundle = (ToolResultMessage) log.get(2);
        assertThat(bundle.getContent()).extracting(ToolResultBlock::getToolUseId)
                .containsExactly("toolu_1", "toolu_2");
        assertThat(bundle.getContent()).noneMatch(ToolResultBlock::isError);
        assertThat(bundle.getContent().get(0).getContent())
                .contains("\"ok\":true").contains("\"dateOfBirth\":\"2022-01-15\"");
        assertThat(bundle.getContent().get(1).getContent())
                .isEqualTo("{\"ok\":true,\"data\":{\"message\":\"¿Querés registrar otra?\"},\"error\":null}");

        WireMessage sentResults = modelClient.requests().get(1).messages().get(2);
        assertThat(sentResults.toolResultIds()).containsExactly("toolu_1", "toolu_2");

        RunContext trace = lastTrace();
        assertThat(trace.getRounds()).isEqualTo(2);
        assertThat(trace.toolCalls()).hasSize(2);
    }

    @Test
    void handle_unknownTool_answeredWithErrorResult() {
        modelClient
                .reply(toolCalls(call("toolu_1", "delete_everything", Map.of())))
                .reply(text("No puedo hacer eso."));

        String reply = agentLoop.handle(inbound("borrá todo", "SM1"));

        assertThat(reply).isEqualTo("No puedo hacer eso.");
        ToolResultMessage bundle = (ToolResultMessage) sessionStore.messages(IDENTITY).get(2);
        ToolResultBlock block = bundle.getContent().get(0);
        assertThat(block.isError()).isTrue();
        assertThat(block.getContent()).contains("Unknown tool: delete_everything");
    }

    @Test
    void handle_invalidToolInput_returnedToModelAsError() {
        modelClient
                .reply(toolCalls(call("toolu_1", "ask_user", Map.of())))
                .reply(text("¿Podés repetir?"));

        agentLoop.handle(inbound("hola", "SM1"));

        ToolResultMessage bundle = (ToolResultMessage) sessionStore.messages(IDENTITY).get(2);
        assertThat(bundle.getContent().get(0).isError()).isTrue();
        assertThat(bundle.getContent().get(0).getContent()).contains("Invalid input for tool ask_user");
    }

    @Test
    void handle_modelKeepsCallingTools_stopsAtRoundLimit() {
        modelClient.reply(toolCalls(call("toolu_1", "ask_user", Map.of("message", "¿?"))));

        String reply = agentLoop.handle(inbound("hola", "SM1"));

        assertThat(reply).isEqualTo(properties.getReplies().getClarification());
        assertThat(modelClient.callCount()).isEqualTo(3);
        assertThat(lastTrace().getOutcome()).isEqualTo(RunOutcome.SAFETY_BREAK);
        assertThat(sessionStore.messages(IDENTITY)).hasSize(7);
    }

    @Test
    void handle_modelUnavailable_apologizesAndKeepsUserTurn() {
        modelClient.fail(new TransientExternalException("Model provider circuit open"));

        String reply = agentLoop.handle(inbound("hola", "SM1"));

        assertThat(reply).isEqualTo(properties.getReplies().getError());
        assertThat(sessionStore.messages(IDENTITY)).containsExactly(new UserMessage("hola"));
        RunContext trace = lastTrace();
        assertThat(trace.getOutcome()).isEqualTo(RunOutcome.ERROR);
        assertThat(trace.getError()).isInstanceOf(TransientExternalException.class);
    }

    @Test
    void handle_blankModelText_fallsBackToEmptyReply() {
        modelClient.reply(text("   "));

        assertThat(agentLoop.handle(inbound("hola", "SM1"))).isEqualTo(properties.getReplies().getEmptyReply());
    }

    @Test
    void handle_duplicateCallIds_failsRunWithoutToolResults() {
        modelClient.reply(toolCalls(
                call("toolu_1", "ask_user", Map.of("message", "a")),
                call("toolu_1", "list_pets", Map.of())));

        String reply = agentLoop.handle(inbound("hola", "SM1"));

        assertThat(reply).isEqualTo(properties.getReplies().getError());
        assertThat(sessionStore.messages(IDENTITY)).noneMatch(m -> m instanceof ToolResultMessage);
    }

    @Test
    void handle_missingIdentity_returnsErrorReply() {
        String reply = agentLoop.handle(InboundMessage.builder().text("hola").build());

        assertThat(reply).isEqualTo(properties.getReplies().getError());
        assertThat(modelClient.callCount()).isZero();
    }

    @Test
    void handle_nullInbound_returnsErrorReplyAndRecordsTrace() {
        String reply = agentLoop.handle(null);

        assertThat(reply).isEqualTo(properties.getReplies().getError());
        assertThat(lastTrace().getOutcome()).isEqualTo(RunOutcome.ERROR);
        assertThat(modelClient.callCount()).isZero();
    }

    @Test
    void handle_unserializableToolResult_answeredWithUnavailableBlock() {
        PetRecord broken = new PetRecord() {
            @Override
            public String getName() {
                throw new IllegalStateException("lazy field not loaded");
            }
        };
        when(gateway.listPetsByOwnerPhone(PHONE)).thenReturn(List.of(broken));
        modelClient
                .reply(toolCalls(call("toolu_1", "list_pets", Map.of())))
                .reply(text("No pude ver tus mascotas."));

        agentLoop.handle(inbound("mis mascotas", "SM1"));

        ToolResultMessage bundle = (ToolResultMessage) sessionStore.messages(IDENTITY).get(2);
        ToolResultBlock block = bundle.getContent().get(0);
        assertThat(block.getToolUseId()).isEqualTo("toolu_1");
        assertThat(block.isError()).isTrue();
        assertThat(block.getContent()).isEqualTo("{\"ok\":false,\"data\":null,\"error\":\"Tool result unavailable\"}");
    }

    @Test
    void handle_followUpMessage_sendsPreviousTurnToModel() {
        modelClient.reply(text("¿Cómo se llama?")).reply(text("Registrado."));

        agentLoop.handle(inbound("quiero registrar un gato", "SM1"));
        agentLoop.handle(inbound("Luna", "SM2"));

        List<WireMessage> sent = modelClient.requests().get(1).messages();
        assertThat(sent).extracting(WireMessage::role).containsExactly("user", "assistant", "user");
    }

    @Test
    void handleAsync_completesWithReply() throws Exception {
        modelClient.reply(text("¡Hola!"));

        assertThat(agentLoop.handleAsync(inbound("hola", "SM1")).get(5, TimeUnit.SECONDS)).isEqualTo("¡Hola!");
    }

    @Test
    void isTermination_caseInsensitiveSubstring() {
        assertThat(agentLoop.isTermination("Chau!")).isTrue();
        assertThat(agentLoop.isTermination("quiero salir")).isTrue();
        assertThat(agentLoop.isTermination("finalmente")).isTrue();
        assertThat(agentLoop.isTermination("hola")).isFalse();
    }

    private static InboundMessage inbound(String text, String messageId) {
        return InboundMessage.builder()
                .identity(IDENTITY)
                .text(text)
                .inboundMessageId(messageId)
                .build();
    }

    private RunContext lastTrace() {
        ArgumentCaptor<RunContext> captor = ArgumentCaptor.forClass(RunContext.class);
        verify(traceService, atLeastOnce()).persistTrace(captor.capture());
        return captor.getValue();
    }
}
