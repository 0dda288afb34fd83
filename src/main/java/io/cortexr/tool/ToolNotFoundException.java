package io.cortexr.tool;

/**
 * Thrown when a tool name is not present in the dispatcher's tool map.
 */
public class ToolNotFoundException extends RuntimeException {

    private final String toolName;

    public ToolNotFoundException(String toolName) {
        super("Tool '" + toolName + "' not found on any server.");
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
