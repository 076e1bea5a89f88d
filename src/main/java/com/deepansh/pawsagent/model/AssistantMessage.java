package com.deepansh.pawsagent.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class AssistantMessage extends SessionMessage {

    private List<ContentBlock> content = new ArrayList<>();

    public List<ToolUseBlock> toolUses() {
        List<ToolUseBlock> uses = new ArrayList<>();
        if (content == null) return uses;
        for (ContentBlock block : content) {
            if (block instanceof ToolUseBlock) {
                uses.add((ToolUseBlock) block);
            }
        }
        return uses;
    }
}
