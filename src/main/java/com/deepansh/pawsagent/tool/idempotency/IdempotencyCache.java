package com.deepansh.pawsagent.tool.idempotency;

import com.deepansh.pawsagent.tool.ToolResult;

import java.util.Optional;

/**
 * Final tool outcomes keyed by idempotency key. A hit means the unit of work already
 * ran and its outcome is returned instead of running it again.
 */
public interface IdempotencyCache {

    Optional<ToolResult> get(String key);

    void put(String key, ToolResult result);
}
