package io.cortexr.sandbox;

import io.cortexr.tool.ToolCallRecord;

import java.util.Map;

/**
 * Observes the tool calls a plan makes while it runs.
 */
public interface ToolCallListener {

    ToolCallListener NONE = new ToolCallListener() {
    };

    /** Called before a call is dispatched. Not called for a call rejected by the budget. */
    default void beforeCall(String toolName, Map<String, Object> arguments) {
    }

    /** Called once the call has completed or failed. */
    default void afterCall(ToolCallRecord record) {
    }
}
