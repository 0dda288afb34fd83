package io.cortexr.tool;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One tool call made by a plan, as recorded in the session log.
 *
 * @param toolName  the tool that was called
 * @param arguments arguments passed to the tool
 * @param result    the payload returned by the tool, or an error payload for failed calls
 * @param success   whether the call succeeded
 * @param timestamp when the call completed
 */
public record ToolCallRecord(
        String toolName,
        Map<String, Object> arguments,
        ToolCallResult result,
        boolean success,
        Instant timestamp
) {
    public ToolCallRecord {
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static ToolCallRecord of(String toolName, Map<String, Object> arguments, ToolCallResult result) {
        return new ToolCallRecord(toolName, arguments, result, result.success(), Instant.now());
    }

    public static ToolCallRecord failed(String toolName, Map<String, Object> arguments, String error) {
        return new ToolCallRecord(toolName, arguments, ToolCallResult.error(error), false, Instant.now());
    }
}
