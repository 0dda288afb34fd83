package io.cortexr.tool;

/**
 * A tool discovered on a tool server.
 *
 * @param name        unique tool name (routing key)
 * @param description human-readable description for the planner
 * @param inputSchema JSON Schema of the tool's arguments, as JSON text
 * @param serverId    id of the server that owns the tool
 */
public record ToolDescriptor(
        String name,
        String description,
        String inputSchema,
        String serverId
) {
    public ToolDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name is required");
        }
        if (description == null) {
            description = "";
        }
        if (inputSchema == null || inputSchema.isBlank()) {
            inputSchema = "{\"type\":\"object\"}";
        }
    }

    /** One summary line as shown to the planner. */
    public String summaryLine() {
        return "- " + name + ": " + description;
    }
}
