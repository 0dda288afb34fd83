package io.cortexr.tool;

/**
 * Thrown when a tool call fails in transport: the server could not be started,
 * the session could not be initialized, or the call itself errored.
 */
public class ToolInvocationException extends RuntimeException {

    private final String toolName;
    private final String serverId;

    public ToolInvocationException(String toolName, String serverId, Throwable cause) {
        super("Tool '" + toolName + "' on server '" + serverId + "' failed: " + cause.getMessage(), cause);
        this.toolName = toolName;
        this.serverId = serverId;
    }

    public String getToolName() {
        return toolName;
    }

    public String getServerId() {
        return serverId;
    }
}
