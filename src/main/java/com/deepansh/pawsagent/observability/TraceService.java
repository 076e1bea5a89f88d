package com.deepansh.pawsagent.observability;

import com.deepansh.pawsagent.session.IdentityNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Persists run traces.
 *
 * Persistence is @Async: it never delays the reply, and a failure here is logged
 * and dropped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    static final int MAX_TEXT = 4000;
    static final int MAX_PREVIEW = 200;

    private final ConversationTraceRepository traceRepository;

    @Async("traceTaskExecutor")
    public void persistTrace(RunContext runCtx) {
        try {
            ConversationTrace trace = toTrace(runCtx);
            traceRepository.save(trace);
            log.info("[{}] Trace persisted [outcome={}, rounds={}, latency={}ms, tokens={}]",
                    runCtx.getRequestId(), trace.getOutcome(), trace.getRounds(),
                    trace.getTotalLatencyMs(), trace.getTotalTokens());
        } catch (Exception e) {
            // Trace persistence must never crash the app
            log.error("[{}] Failed to persist run trace", runCtx.getRequestId(), e);
        }
    }

    ConversationTrace toTrace(RunContext runCtx) {
        List<ConversationTrace.ToolCall> toolCalls = runCtx.toolCalls().stream()
                .map(r -> new ConversationTrace.ToolCall(
                        r.toolName(), r.latencyMs(), r.ok(), truncate(r.resultPreview(), MAX_PREVIEW)))
                .toList();

        RunOutcome outcome = runCtx.getOutcome() != null ? runCtx.getOutcome() : RunOutcome.ERROR;
        Throwable error = runCtx.getError();

        return ConversationTrace.builder()
                .requestId(runCtx.getRequestId())
                .identity(runCtx.getIdentity() != null ? IdentityNormalizer.normalize(runCtx.getIdentity()) : null)
                .inboundMessageId(runCtx.getInboundMessageId())
                .userInput(truncate(runCtx.getUserInput(), MAX_TEXT))
                .reply(truncate(runCtx.getReply(), MAX_TEXT))
                .outcome(outcome)
                .rounds(runCtx.getRounds())
                .totalLatencyMs(runCtx.elapsedMs())
                .inputTokens(runCtx.getInputTokens())
                .outputTokens(runCtx.getOutputTokens())
                .totalTokens(runCtx.totalTokens())
                .toolCalls(toolCalls)
                .errorMessage(error != null ? truncate(String.valueOf(error.getMessage()), MAX_TEXT) : null)
                .build();
    }

    private String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}
