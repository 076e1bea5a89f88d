package com.deepansh.pawsagent.transcode;

import com.deepansh.pawsagent.model.AssistantMessage;
import com.deepansh.pawsagent.model.ContentBlock;
import com.deepansh.pawsagent.model.SessionMessage;
import com.deepansh.pawsagent.model.TextBlock;
import com.deepansh.pawsagent.model.ToolResultBlock;
import com.deepansh.pawsagent.model.ToolResultMessage;
import com.deepansh.pawsagent.model.ToolUseBlock;
import com.deepansh.pawsagent.model.UserMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns the stored conversation log into the provider's {@code messages} array.
 *
 * The provider rejects requests that do not alternate user/assistant, that open
 * with an assistant message, or that carry a tool call without its result (or a
 * result without its call). A stored log can break all three after trimming,
 * a crash mid-round or a lost write, so every rule here repairs by dropping and
 * never fails. Each repair is reported as a warning.
 *
 * Pure and stateless; the input list is never mutated.
 */
@Component
@Slf4j
public class MessageTranscoder {

    public TranscodeResult transcode(List<SessionMessage> log) {
        List<String> warnings = new ArrayList<>();
        List<WireMessage> out = new ArrayList<>();

        for (int i = 0; i < log.size(); i++) {
            WireMessage next = toWire(log.get(i), i, warnings);
            if (next == null) continue;

            if (next.hasToolResults()) {
                appendBundle(out, next, i, warnings);
            } else if (out.isEmpty() && next.isAssistant()) {
                warnings.add("Dropped assistant message at " + i + ": conversation must open with a user message");
            } else {
                appendOrMerge(out, next, i, warnings);
            }
        }

        List<WireMessage> pruned = pruneUnansweredToolUses(out, warnings);

        if (!warnings.isEmpty()) {
            MessageTranscoder.log.warn("Transcoded {} stored messages into {} with {} repair(s): {}",
                    log.size(), pruned.size(), warnings.size(), warnings);
        }
        return new TranscodeResult(List.copyOf(pruned), List.copyOf(warnings));
    }

    private WireMessage toWire(SessionMessage message, int index, List<String> warnings) {
        if (message instanceof UserMessage) {
            String text = ((UserMessage) message).getText();
            if (text == null || text.isBlank()) {
                warnings.add("Dropped empty user message at " + index);
                return null;
            }
            List<ContentBlock> content = new ArrayList<>();
            content.add(new TextBlock(text));
            return new WireMessage(WireMessage.USER, content);
        }
        if (message instanceof AssistantMessage) {
            List<ContentBlock> content = nonBlank(((AssistantMessage) message).getContent(), index, warnings);
            if (content.isEmpty()) {
                warnings.add("Dropped empty assistant message at " + index);
                return null;
            }
            return new WireMessage(WireMessage.ASSISTANT, content);
        }
        if (message instanceof ToolResultMessage) {
            List<ContentBlock> content = nonBlank(((ToolResultMessage) message).getContent(), index, warnings);
            if (content.isEmpty()) {
                warnings.add("Dropped empty tool result bundle at " + index);
                return null;
            }
            return new WireMessage(WireMessage.USER, content);
        }
        warnings.add("Dropped unsupported message type at " + index + ": "
                + (message == null ? "null" : message.getClass().getSimpleName()));
        return null;
    }

    /**
     * A bundle is only valid straight after the assistant message that issued its
     * calls, and must not answer the same call twice.
     */
    private void appendBundle(List<WireMessage> out, WireMessage bundle, int index, List<String> warnings) {
        WireMessage previous = out.isEmpty() ? null : out.get(out.size() - 1);
        if (previous == null || !previous.isAssistant()) {
            warnings.add("Dropped tool result bundle at " + index + ": not preceded by an assistant message");
            return;
        }

        Set<String> seen = new HashSet<>();
        for (ContentBlock block : bundle.content()) {
            String id = ((ToolResultBlock) block).getToolUseId();
            if (!seen.add(id)) {
                warnings.add("Dropped tool result bundle at " + index + ": duplicate result for " + id);
                return;
            }
        }

        Set<String> issued = previous.toolUseIds();
        if (!issued.containsAll(seen)) {
            warnings.add("Dropped tool result bundle at " + index + ": results " + seen
                    + " do not match calls " + issued);
            return;
        }
        out.add(bundle);
    }

    private void appendOrMerge(List<WireMessage> out, WireMessage next, int index, List<String> warnings) {
        if (out.isEmpty()) {
            out.add(next);
            return;
        }
        WireMessage previous = out.get(out.size() - 1);
        if (!previous.role().equals(next.role())) {
            out.add(next);
            return;
        }
        if (previous.hasToolResults() || next.hasToolResults()) {
            warnings.add("Kept consecutive " + next.role() + " message at " + index
                    + " unmerged: tool results cannot be merged");
            out.add(next);
            return;
        }
        out.set(out.size() - 1, merge(previous, next));
    }

    /**
     * Removes tool_use blocks that the following message does not answer. An assistant
     * message left with nothing is dropped, which can put two user messages side by
     * side, so neighbours are merged again afterwards.
     */
    private List<WireMessage> pruneUnansweredToolUses(List<WireMessage> messages, List<String> warnings) {
        List<WireMessage> kept = new ArrayList<>();
        for (int i = 0; i < messages.size(); i++) {
            WireMessage message = messages.get(i);
            if (!message.isAssistant() || message.toolUseIds().isEmpty()) {
                kept.add(message);
                continue;
            }

            WireMessage following = i + 1 < messages.size() ? messages.get(i + 1) : null;
            Set<String> answered = following != null && following.hasToolResults()
                    ? following.toolResultIds() : Set.of();

            List<ContentBlock> content = new ArrayList<>();
            for (ContentBlock block : message.content()) {
                if (block instanceof ToolUseBlock && !answered.contains(((ToolUseBlock) block).getId())) {
                    warnings.add("Pruned unanswered tool call " + ((ToolUseBlock) block).getId()
                            + " (" + ((ToolUseBlock) block).getName() + ")");
                    continue;
                }
                content.add(block);
            }

            if (content.isEmpty()) {
                warnings.add("Dropped assistant message left empty after pruning");
                continue;
            }
            kept.add(new WireMessage(message.role(), content));
        }

        List<WireMessage> merged = new ArrayList<>();
        for (WireMessage message : kept) {
            WireMessage previous = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (previous != null && previous.role().equals(message.role())
                    && !previous.hasToolResults() && !message.hasToolResults()) {
                merged.set(merged.size() - 1, merge(previous, message));
            } else {
                merged.add(message);
            }
        }
        return merged;
    }

    private static WireMessage merge(WireMessage first, WireMessage second) {
        List<ContentBlock> content = new ArrayList<>(first.content());
        content.addAll(second.content());
        return new WireMessage(first.role(), content);
    }

    private static List<ContentBlock> nonBlank(List<? extends ContentBlock> blocks, int index, List<String> warnings) {
        List<ContentBlock> result = new ArrayList<>();
        if (blocks == null) return result;
        for (ContentBlock block : blocks) {
            if (block == null || block.blank()) {
                warnings.add("Dropped blank " + (block == null ? "null" : block.getClass().getSimpleName())
                        + " from message at " + index);
                continue;
            }
            result.add(block);
        }
        return result;
    }
}
