package com.deepansh.pawsagent.tool;

import java.util.Map;
import java.util.Optional;

/**
 * Contract every tool must implement.
 *
 * The name, description and {@link #getInputSchema()} are sent to the model as the
 * tool's capability declaration. {@link #getInputType()} is the class the raw model
 * input is converted into; its Bean Validation constraints are the input validator.
 *
 * Expected failures (not found, already registered) are returned as
 * {@link ToolResult#failure(String)} and are final. Throw only for failures worth
 * retrying: the {@link ToolRunner} retries thrown exceptions and timeouts.
 *
 * A timed-out attempt is interrupted. A handler blocked in I/O that ignores interrupts
 * can still finish after its retry has started, so handlers with side effects look up
 * before they create.
 *
 * @param <I> validated input type
 */
public interface ToolHandler<I> {

    /** Unique snake_case name the model uses to invoke this tool */
    String getName();

    /**
     * Human-readable description. This is the primary signal the model uses
     * to decide when to call this tool.
     */
    String getDescription();

    /** JSON Schema (as a Map) describing the tool's input object. */
    Map<String, Object> getInputSchema();

    Class<I> getInputType();

    /** Overrides for timeout/retries/delay; unset fields fall back to the runner defaults. */
    default Optional<ToolPolicy> getPolicy() {
        return Optional.empty();
    }

    /** Disabled tools are left out of the capability set and cannot be dispatched. */
    default boolean isEnabled() {
        return true;
    }

    ToolResult execute(I input, ToolContext context);
}
