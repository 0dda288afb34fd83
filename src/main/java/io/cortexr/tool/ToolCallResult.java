package io.cortexr.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw result payload of a tool call: {@code {content: [{text: ...}, ...], success}}.
 *
 * @param content text segments returned by the tool, in order
 * @param success false when the tool itself reported an error
 */
public record ToolCallResult(List<Content> content, boolean success) {

    public ToolCallResult {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static ToolCallResult ok(String... texts) {
        List<Content> items = new ArrayList<>();
        for (String text : texts) {
            items.add(new Content(text));
        }
        return new ToolCallResult(items, true);
    }

    public static ToolCallResult error(String text) {
        return new ToolCallResult(List.of(new Content(text)), false);
    }

    /**
     * Returns the text of the first content item, or empty string if none.
     */
    public String firstText() {
        return content.isEmpty() ? "" : content.get(0).text();
    }

    /**
     * Converts the result into the plain map shape exposed to plan code.
     */
    public Map<String, Object> toPayload() {
        List<Object> items = new ArrayList<>();
        for (Content c : content) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("text", c.text());
            items.add(item);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("content", items);
        payload.put("success", success);
        return payload;
    }

    /** A single text content item. */
    public record Content(String text) {
        public Content {
            if (text == null) {
                text = "";
            }
        }
    }
}
