package com.deepansh.pawsagent.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A tool call requested by the model. {@code id} must be echoed back
 * in the matching {@link ToolResultBlock}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class ToolUseBlock extends ContentBlock {

    private String id;
    private String name;
    private Map<String, Object> input;

    @Override
    public boolean blank() {
        return name == null || name.isBlank();
    }
}
