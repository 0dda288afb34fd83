package io.cortexr.sandbox;

import io.cortexr.tool.ToolCallRecord;

import java.util.List;

/**
 * Outcome of running one plan.
 *
 * @param status    whether the plan completed, failed, or ran out of tool calls
 * @param text      the normalized result, or the {@code [sandbox error: ...]} sentinel
 * @param toolCalls every tool call the plan attempted, in order
 */
public record SandboxResult(Status status, String text, List<ToolCallRecord> toolCalls) {

    public enum Status { OK, ERROR, EXHAUSTED }

    public SandboxResult {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public boolean isSuccess() {
        return status == Status.OK;
    }

    static SandboxResult ok(String text, List<ToolCallRecord> toolCalls) {
        return new SandboxResult(Status.OK, text, toolCalls);
    }

    static SandboxResult error(Status status, String message, List<ToolCallRecord> toolCalls) {
        return new SandboxResult(status, PlanExecutor.ERROR_PREFIX + message + "]", toolCalls);
    }
}
