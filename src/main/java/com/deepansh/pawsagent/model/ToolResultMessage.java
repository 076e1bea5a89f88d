package com.deepansh.pawsagent.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Bundle of tool results answering the assistant message right before it:
 * one block per call-id, no more, no less.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class ToolResultMessage extends SessionMessage {

    private List<ToolResultBlock> content = new ArrayList<>();
}
