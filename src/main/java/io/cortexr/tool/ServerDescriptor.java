package io.cortexr.tool;

import java.util.List;
import java.util.Map;

/**
 * Configuration for a single tool server process.
 *
 * <p>Bound from {@code cortex.tool-servers} in application.yml:</p>
 * <pre>
 * cortex:
 *   tool-servers:
 *     - id: math
 *       command: python
 *       args: ["mcp_server_1.py", "--stdio"]
 *       working-directory: ./servers
 *       description: Arithmetic and number utilities
 * </pre>
 *
 * @param id                    unique server id, also used by the planner's {@code selected_servers}
 * @param command               executable to launch (e.g. {@code python}, {@code npx})
 * @param args                  command arguments, usually the server script
 * @param workingDirectory      directory the process is started in (defaults to the current one)
 * @param description           human description shown to the planner during perception
 * @param env                   extra environment variables for the process
 * @param enabled               whether this server takes part in discovery (default true)
 * @param requestTimeoutSeconds MCP request timeout (default 30)
 */
public record ServerDescriptor(
        String id,
        String command,
        List<String> args,
        String workingDirectory,
        String description,
        Map<String, String> env,
        Boolean enabled,
        Integer requestTimeoutSeconds
) {
    public ServerDescriptor {
        if (args == null) {
            args = List.of();
        }
        if (env == null) {
            env = Map.of();
        }
        if (enabled == null) {
            enabled = true;
        }
        if (requestTimeoutSeconds == null) {
            requestTimeoutSeconds = 30;
        }
        if (description == null) {
            description = "";
        }
    }

    /** Convenience constructor for an enabled server with default timeout and environment. */
    public ServerDescriptor(String id, String command, List<String> args, String workingDirectory, String description) {
        this(id, command, args, workingDirectory, description, null, null, null);
    }

    public boolean isEnabled() {
        return enabled;
    }
}
