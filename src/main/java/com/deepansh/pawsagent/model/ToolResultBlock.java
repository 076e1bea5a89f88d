package com.deepansh.pawsagent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class ToolResultBlock extends ContentBlock {

    @JsonProperty("tool_use_id")
    private String toolUseId;

    /** JSON-serialized ToolResult */
    private String content;

    @JsonProperty("is_error")
    private boolean error;

    @Override
    public boolean blank() {
        return toolUseId == null || toolUseId.isBlank();
    }
}
