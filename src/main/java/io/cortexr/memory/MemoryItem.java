package io.cortexr.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.cortexr.tool.ToolCallRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One entry in a session log. Serialized with snake_case keys, one JSON array per session file.
 *
 * @param timestamp epoch seconds with fractional part
 * @param type      {@code run_metadata}, {@code tool_output}, {@code step_result} or {@code final_answer}
 * @param text      human-readable description
 * @param sessionId owning session
 * @param tags      free-form tags, e.g. {@code run_start}
 * @param toolName  tool name for {@code tool_output} items
 * @param toolArgs  tool arguments for {@code tool_output} items
 * @param toolResult tool result payload for {@code tool_output} items
 * @param success   outcome for {@code tool_output} and {@code final_answer} items
 * @param userQuery the query that started the session, on {@code run_metadata} and {@code final_answer} items
 * @param metadata  additional data
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"timestamp", "type", "text", "session_id", "tags", "tool_name", "tool_args",
        "tool_result", "success", "user_query", "metadata"})
public record MemoryItem(
        @JsonProperty("timestamp") double timestamp,
        @JsonProperty("type") String type,
        @JsonProperty("text") String text,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("tool_name") String toolName,
        @JsonProperty("tool_args") Map<String, Object> toolArgs,
        @JsonProperty("tool_result") Map<String, Object> toolResult,
        @JsonProperty("success") Boolean success,
        @JsonProperty("user_query") String userQuery,
        @JsonProperty("metadata") Map<String, Object> metadata
) {

    public static final String RUN_METADATA = "run_metadata";
    public static final String TOOL_OUTPUT = "tool_output";
    public static final String STEP_RESULT = "step_result";
    public static final String FINAL_ANSWER = "final_answer";

    public static final String TAG_RUN_START = "run_start";

    public MemoryItem {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Memory item type must not be blank");
        }
        if (text == null) {
            text = "";
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? new LinkedHashMap<>() : metadata;
    }

    static double now() {
        return System.currentTimeMillis() / 1000.0;
    }

    /**
     * The first item of every session log.
     */
    public static MemoryItem runStart(String sessionId, String userQuery) {
        return new MemoryItem(now(), RUN_METADATA, "Started new session with input: " + userQuery,
                sessionId, List.of(TAG_RUN_START), null, null, null, null, userQuery, null);
    }

    public static MemoryItem toolOutput(String sessionId, ToolCallRecord call) {
        String text = "Tool '" + call.toolName() + "' " + (call.success() ? "succeeded" : "failed")
                + ". Result: " + call.result().firstText();
        return new MemoryItem(call.timestamp().toEpochMilli() / 1000.0, TOOL_OUTPUT, text, sessionId,
                List.of(), call.toolName(), new LinkedHashMap<>(call.arguments()),
                call.result().toPayload(), call.success(), null, null);
    }

    public static MemoryItem stepResult(String sessionId, int step, String text) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("step", step);
        return new MemoryItem(now(), STEP_RESULT, text, sessionId, List.of("step_" + step),
                null, null, null, null, null, metadata);
    }

    public static MemoryItem finalAnswer(String sessionId, String userQuery, String answer, boolean success) {
        return new MemoryItem(now(), FINAL_ANSWER, answer, sessionId, List.of(),
                null, null, null, success, userQuery, null);
    }

    public boolean isType(String expected) {
        return expected.equals(type);
    }

    public boolean isSuccessful() {
        return Boolean.TRUE.equals(success);
    }
}
