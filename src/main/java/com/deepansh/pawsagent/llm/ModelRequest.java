package com.deepansh.pawsagent.llm;

import com.deepansh.pawsagent.tool.ToolDefinition;
import com.deepansh.pawsagent.transcode.WireMessage;

import java.util.List;

public record ModelRequest(String systemPrompt, List<ToolDefinition> tools, List<WireMessage> messages) {
}
