package com.deepansh.pawsagent.observability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Persists a full trace of every loop run to MongoDB.
 *
 * Captures:
 * - Input / reply and how the run ended
 * - Total latency and per-tool latency
 * - Token usage (input + output)
 * - Failure details if the run errored
 */
@Document(collection = "conversation_traces")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationTrace {

    @Id
    private String id;

    @Indexed
    private String requestId;

    @Indexed
    private String identity;

    private String inboundMessageId;
    private String userInput;
    private String reply;

    @Indexed
    private RunOutcome outcome;

    private int rounds;
    private long totalLatencyMs;

    private int inputTokens;
    private int outputTokens;
    private int totalTokens;

    /** Tool calls in dispatch order */
    private List<ToolCall> toolCalls;

    /** Error message if outcome = ERROR */
    private String errorMessage;

    @CreatedDate
    @Indexed
    private Instant createdAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCall {
        private String toolName;
        private long latencyMs;
        private boolean ok;
        private String resultPreview;
    }
}
