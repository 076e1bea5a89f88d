package com.deepansh.pawsagent.core;

import com.deepansh.pawsagent.config.AgentProperties;
import com.deepansh.pawsagent.exception.ProtocolInconsistencyException;
import com.deepansh.pawsagent.llm.ModelClient;
import com.deepansh.pawsagent.llm.ModelRequest;
import com.deepansh.pawsagent.llm.ModelResponse;
import com.deepansh.pawsagent.model.AssistantMessage;
import com.deepansh.pawsagent.model.InboundMessage;
import com.deepansh.pawsagent.model.ToolResultBlock;
import com.deepansh.pawsagent.model.ToolResultMessage;
import com.deepansh.pawsagent.model.ToolUseBlock;
import com.deepansh.pawsagent.model.UserMessage;
import com.deepansh.pawsagent.observability.RunContext;
import com.deepansh.pawsagent.observability.RunOutcome;
import com.deepansh.pawsagent.observability.TraceService;
import com.deepansh.pawsagent.session.SessionStore;
import com.deepansh.pawsagent.tool.ToolContext;
import com.deepansh.pawsagent.tool.ToolDefinition;
import com.deepansh.pawsagent.tool.ToolHandler;
import com.deepansh.pawsagent.tool.ToolRegistry;
import com.deepansh.pawsagent.tool.ToolResult;
import com.deepansh.pawsagent.tool.ToolRunner;
import com.deepansh.pawsagent.transcode.MessageTranscoder;
import com.deepansh.pawsagent.transcode.TranscodeResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Core agent loop: one run per inbound message.
 *
 * Per-run flow:
 * 1. Duplicate delivery → "already processed", nothing else touched
 * 2. Termination keyword → session deleted, farewell, no model call
 * 3. Append the user message
 * 4. Rounds: transcode → model → either a text reply (done) or tool calls, run
 *    concurrently, one result block per call id, appended as one bundle → next round
 * 5. Round budget exhausted → clarification reply
 * 6. Async: persist trace
 *
 * Every failure ends in a configured reply; nothing escapes {@link #handle}.
 */
@Service
@Slf4j
public class AgentLoop {

    private final SessionStore sessionStore;
    private final MessageTranscoder transcoder;
    private final ModelClient modelClient;
    private final ToolRegistry toolRegistry;
    private final ToolRunner toolRunner;
    private final TraceService traceService;
    private final ObjectMapper objectMapper;
    private final AgentProperties properties;
    private final Executor agentExecutor;

    /** Content of the block that stands in for a missing or unserializable result */
    private final String unavailableJson;

    public AgentLoop(SessionStore sessionStore,
                     MessageTranscoder transcoder,
                     ModelClient modelClient,
                     ToolRegistry toolRegistry,
                     ToolRunner toolRunner,
                     TraceService traceService,
                     ObjectMapper objectMapper,
                     AgentProperties properties,
                     @Qualifier("agentTaskExecutor") Executor agentExecutor) {
        this.sessionStore = sessionStore;
        this.transcoder = transcoder;
        this.modelClient = modelClient;
        this.toolRegistry = toolRegistry;
        this.toolRunner = toolRunner;
        this.traceService = traceService;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.agentExecutor = agentExecutor;
        try {
            this.unavailableJson = objectMapper.writeValueAsString(ToolResult.unavailable());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("ObjectMapper cannot serialize ToolResult", e);
        }
    }

    /** Runs {@link #handle} on the agent pool. The future always completes with a reply. */
    public CompletableFuture<String> handleAsync(InboundMessage inbound) {
        try {
            return CompletableFuture.supplyAsync(() -> handle(inbound), agentExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Agent pool saturated, rejecting message from {}",
                    inbound != null ? inbound.getIdentity() : null, e);
            return CompletableFuture.completedFuture(properties.getReplies().getError());
        }
    }

    public String handle(InboundMessage inbound) {
        String requestId = UUID.randomUUID().toString();
        RunContext runCtx = inbound != null
                ? new RunContext(requestId, inbound.getIdentity(), inbound.getInboundMessageId(), inbound.getText())
                : new RunContext(requestId, null, null, null);
        String reply = null;

        try {
            reply = run(inbound, runCtx);
        } catch (Exception e) {
            log.error("[{}] Agent loop failed", requestId, e);
            runCtx.setOutcome(RunOutcome.ERROR);
            runCtx.setError(e);
            reply = properties.getReplies().getError();
        } finally {
            runCtx.setReply(reply);
            persistTrace(runCtx);
        }

        log.info("[{}] Agent run complete [outcome={}, rounds={}, latency={}ms, tokens={}]",
                requestId, runCtx.getOutcome(), runCtx.getRounds(), runCtx.elapsedMs(), runCtx.totalTokens());
        return reply;
    }

    private String run(InboundMessage inbound, RunContext runCtx) {
        String requestId = runCtx.getRequestId();
        if (inbound == null) {
            throw new IllegalArgumentException("No inbound message");
        }
        String identity = inbound.getIdentity();
        String text = inbound.getText() != null ? inbound.getText() : "";
        String messageId = inbound.getInboundMessageId();

        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Inbound message has no identity");
        }

        log.info("[{}] Starting agent loop for {} [messageId={}, text='{}']",
                requestId, identity, messageId, preview(text));

        if (messageId != null && !messageId.isBlank()) {
            // isSeen first: a plain read avoids a write for the common redelivery case
            if (sessionStore.isSeen(messageId) || !sessionStore.markSeen(messageId)) {
                log.info("[{}] Message already seen: {}", requestId, messageId);
                runCtx.setOutcome(RunOutcome.DUPLICATE);
                return properties.getReplies().getAlreadyProcessed();
            }
        }

        if (isTermination(text)) {
            sessionStore.end(identity);
            log.info("[{}] Session ended by user", requestId);
            runCtx.setOutcome(RunOutcome.TERMINATED);
            return properties.getReplies().getFarewell();
        }

        AgentContext context = AgentContext.builder()
                .requestId(requestId)
                .identity(identity)
                .inboundMessageId(messageId)
                .userInput(text)
                .toolContext(new ToolContext(requestId, identity, messageId))
                .session(sessionStore.append(identity, new UserMessage(text)))
                .build();
        log.info("[{}] Session loaded with {} messages", requestId, context.getSession().getMessages().size());

        return executeRounds(context, runCtx);
    }

    private String executeRounds(AgentContext context, RunContext runCtx) {
        String requestId = context.getRequestId();
        List<ToolDefinition> tools = toolRegistry.getEnabledDefinitions();
        int maxRounds = properties.getMaxRounds();

        for (int round = 1; round <= maxRounds; round++) {
            runCtx.startRound();
            log.info("[{}] Starting round {}/{}", requestId, round, maxRounds);

            TranscodeResult transcoded = transcoder.transcode(context.getSession().getMessages());
            if (!transcoded.isSendable()) {
                throw new ProtocolInconsistencyException("Conversation not sendable after transcoding "
                        + context.getSession().getMessages().size() + " stored messages: " + transcoded.warnings());
            }

            ModelResponse response = modelClient.complete(
                    new ModelRequest(properties.getSystemPrompt(), tools, transcoded.messages()));
            runCtx.addTokens(response.getInputTokens(), response.getOutputTokens());
            log.info("[{}] Model response: {} input, {} output tokens [stop={}]", requestId,
                    response.getInputTokens(), response.getOutputTokens(), response.getStopReason());

            AssistantMessage assistant = new AssistantMessage(new ArrayList<>(response.getContent()));
            List<ToolUseBlock> toolUses = assistant.toolUses();
            context.setSession(sessionStore.append(context.getIdentity(), assistant));

            if (toolUses.isEmpty()) {
                runCtx.setOutcome(RunOutcome.REPLIED);
                String reply = response.joinText();
                if (reply.isEmpty()) {
                    log.warn("[{}] Model returned no text", requestId);
                    return properties.getReplies().getEmptyReply();
                }
                log.info("[{}] Completed in {}ms with text response", requestId, runCtx.elapsedMs());
                return reply;
            }

            requireUniqueCallIds(toolUses);
            log.info("[{}] Executing {} tools", requestId, toolUses.size());

            List<ToolResultBlock> results = runTools(toolUses, context.getToolContext(), runCtx);
            context.setSession(sessionStore.append(context.getIdentity(), new ToolResultMessage(results)));
        }

        log.warn("[{}] Hit safety breaker after {} rounds", requestId, maxRounds);
        runCtx.setOutcome(RunOutcome.SAFETY_BREAK);
        return properties.getReplies().getClarification();
    }

    /**
     * Dispatches every call concurrently and waits for all of them. The returned list
     * holds exactly one block per call, in call order.
     */
    private List<ToolResultBlock> runTools(List<ToolUseBlock> toolUses, ToolContext toolContext, RunContext runCtx) {
        List<CompletableFuture<TimedResult>> pending = new ArrayList<>();
        for (ToolUseBlock use : toolUses) {
            long started = System.currentTimeMillis();
            pending.add(dispatch(use, toolContext)
                    .thenApply(result -> new TimedResult(result, System.currentTimeMillis() - started)));
        }

        CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).join();

        List<ToolResultBlock> blocks = new ArrayList<>(toolUses.size());
        for (int i = 0; i < toolUses.size(); i++) {
            ToolUseBlock use = toolUses.get(i);
            TimedResult timed = pending.get(i).join();
            ToolResultBlock block = toResultBlock(use.getId(), timed.result(), toolContext.requestId());
            runCtx.recordToolCall(use.getName(), timed.latencyMs(), !block.isError(), block.getContent());
            blocks.add(block);
        }
        return blocks;
    }

    private CompletableFuture<ToolResult> dispatch(ToolUseBlock use, ToolContext toolContext) {
        Optional<ToolHandler<?>> handler = toolRegistry.find(use.getName());
        if (handler.isEmpty()) {
            log.warn("[{}] Unknown tool requested: {} (available: {})",
                    toolContext.requestId(), use.getName(), toolRegistry.toolNames());
            return CompletableFuture.completedFuture(ToolResult.failure("Unknown tool: " + use.getName()));
        }

        log.info("[{}] Executing tool: {} {}", toolContext.requestId(), use.getName(), use.getInput());
        try {
            return toolRunner.executeAsync(handler.get(), use.getInput(), toolContext)
                    .exceptionally(e -> ToolResult.failure("Tool " + use.getName() + " failed: " + e.getMessage()));
        } catch (RuntimeException e) {
            log.error("[{}] Dispatch of {} failed", toolContext.requestId(), use.getName(), e);
            return CompletableFuture.completedFuture(
                    ToolResult.failure("Tool " + use.getName() + " failed: " + e.getMessage()));
        }
    }

    private ToolResultBlock toResultBlock(String toolUseId, ToolResult result, String requestId) {
        if (result == null) {
            return new ToolResultBlock(toolUseId, unavailableJson, true);
        }
        try {
            return new ToolResultBlock(toolUseId, objectMapper.writeValueAsString(result), !result.ok());
        } catch (JsonProcessingException e) {
            log.warn("[{}] Tool result for {} is not serializable: {}", requestId, toolUseId, e.getMessage());
            return new ToolResultBlock(toolUseId, unavailableJson, true);
        }
    }

    private void requireUniqueCallIds(List<ToolUseBlock> toolUses) {
        Set<String> ids = new HashSet<>();
        for (ToolUseBlock use : toolUses) {
            if (use.getId() == null || use.getId().isBlank()) {
                throw new ProtocolInconsistencyException("Tool call " + use.getName() + " has no id");
            }
            if (!ids.add(use.getId())) {
                throw new ProtocolInconsistencyException("Duplicate tool call id " + use.getId());
            }
        }
    }

    boolean isTermination(String text) {
        String upper = text.toUpperCase(Locale.ROOT);
        return properties.getTerminationKeywords().stream()
                .anyMatch(keyword -> upper.contains(keyword.toUpperCase(Locale.ROOT)));
    }

    private void persistTrace(RunContext runCtx) {
        try {
            traceService.persistTrace(runCtx);
        } catch (RuntimeException e) {
            log.error("[{}] Could not schedule trace persistence", runCtx.getRequestId(), e);
        }
    }

    private static String preview(String text) {
        return text.length() > 100 ? text.substring(0, 100) + "..." : text;
    }

    private record TimedResult(ToolResult result, long latencyMs) {}
}
