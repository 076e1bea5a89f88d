package com.deepansh.pawsagent.llm;

import com.deepansh.pawsagent.model.ContentBlock;
import com.deepansh.pawsagent.model.TextBlock;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Normalized completion. {@code content} holds only text and tool_use blocks,
 * in the order the model produced them.
 */
@Data
@Builder
public class ModelResponse {

    @Builder.Default
    private List<ContentBlock> content = new ArrayList<>();

    private String stopReason;
    private int inputTokens;
    private int outputTokens;

    /** Text blocks joined with a newline and trimmed; empty when there are none. */
    public String joinText() {
        return content.stream()
                .filter(block -> block instanceof TextBlock)
                .map(block -> ((TextBlock) block).getText())
                .filter(text -> text != null)
                .collect(Collectors.joining("\n"))
                .trim();
    }
}
