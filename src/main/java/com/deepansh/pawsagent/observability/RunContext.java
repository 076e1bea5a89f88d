package com.deepansh.pawsagent.observability;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-run context for collecting observability data.
 * Created at the start of each loop run, populated throughout,
 * then flushed to a ConversationTrace at the end.
 *
 * Kept separate from AgentContext (which holds conversation state)
 * so observability concerns don't bleed into the core loop.
 */
@Getter
public class RunContext {

    private final String requestId;
    private final String identity;
    private final String inboundMessageId;
    private final String userInput;
    private final long startTimeMs = System.currentTimeMillis();
    private final List<ToolCallRecord> toolCallRecords = new ArrayList<>();

    private int inputTokens;
    private int outputTokens;
    private int rounds;

    @Setter
    private RunOutcome outcome;
    @Setter
    private String reply;
    @Setter
    private Throwable error;

    public RunContext(String requestId, String identity, String inboundMessageId, String userInput) {
        this.requestId = requestId;
        this.identity = identity;
        this.inboundMessageId = inboundMessageId;
        this.userInput = userInput;
    }

    public synchronized void recordToolCall(String toolName, long latencyMs, boolean ok, String resultPreview) {
        toolCallRecords.add(new ToolCallRecord(toolName, latencyMs, ok, resultPreview));
    }

    public synchronized List<ToolCallRecord> toolCalls() {
        return List.copyOf(toolCallRecords);
    }

    public synchronized void addTokens(int input, int output) {
        this.inputTokens += input;
        this.outputTokens += output;
    }

    public synchronized void startRound() {
        rounds++;
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public synchronized int totalTokens() {
        return inputTokens + outputTokens;
    }

    public record ToolCallRecord(
            String toolName,
            long latencyMs,
            boolean ok,
            String resultPreview
    ) {}
}
