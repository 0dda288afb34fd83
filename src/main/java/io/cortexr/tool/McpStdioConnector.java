package io.cortexr.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Connects to MCP tool servers over stdio using the MCP Java SDK.
 * Each {@link #open} launches a fresh server process in the configured working directory.
 */
@Component
public class McpStdioConnector implements ToolServerConnector {

    private static final Logger log = LoggerFactory.getLogger(McpStdioConnector.class);

    private final ObjectMapper objectMapper;

    public McpStdioConnector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Session open(ServerDescriptor server) {
        StdioClientTransport transport = createTransport(server);
        Duration timeout = Duration.ofSeconds(server.requestTimeoutSeconds());

        McpSyncClient client = McpClient.sync(transport)
                .requestTimeout(timeout)
                .initializationTimeout(timeout)
                .build();
        try {
            client.initialize();
        } catch (RuntimeException e) {
            closeQuietly(server.id(), client);
            throw e;
        }
        log.debug("MCP session initialized with server '{}'", server.id());
        return new McpSession(server.id(), client);
    }

    /**
     * Builds the stdio transport for a server. Package-private for testing.
     */
    StdioClientTransport createTransport(ServerDescriptor server) {
        if (server.command() == null || server.command().isBlank()) {
            throw new IllegalStateException("Tool server '" + server.id()
                    + "' requires a 'command' for stdio transport");
        }

        var paramsBuilder = ServerParameters.builder(server.command());
        if (!server.args().isEmpty()) {
            paramsBuilder.args(server.args());
        }
        if (!server.env().isEmpty()) {
            paramsBuilder.env(server.env());
        }

        File workingDirectory = resolveWorkingDirectory(server);
        return new StdioClientTransport(paramsBuilder.build(), objectMapper) {
            @Override
            protected ProcessBuilder getProcessBuilder() {
                ProcessBuilder builder = new ProcessBuilder();
                if (workingDirectory != null) {
                    builder.directory(workingDirectory);
                }
                return builder;
            }
        };
    }

    static File resolveWorkingDirectory(ServerDescriptor server) {
        if (server.workingDirectory() == null || server.workingDirectory().isBlank()) {
            return null;
        }
        File dir = new File(server.workingDirectory());
        if (!dir.isDirectory()) {
            throw new IllegalStateException("Working directory for tool server '" + server.id()
                    + "' does not exist: " + dir.getAbsolutePath());
        }
        return dir;
    }

    private static void closeQuietly(String serverId, McpSyncClient client) {
        try {
            client.closeGracefully();
        } catch (Exception e) {
            log.warn("Error closing MCP client '{}': {}", serverId, e.getMessage());
        }
    }

    private final class McpSession implements Session {

        private final String serverId;
        private final McpSyncClient client;

        McpSession(String serverId, McpSyncClient client) {
            this.serverId = serverId;
            this.client = client;
        }

        @Override
        public List<ToolDescriptor> listTools() {
            McpSchema.ListToolsResult result = client.listTools();
            List<ToolDescriptor> tools = new ArrayList<>();
            if (result.tools() == null) {
                return tools;
            }
            for (McpSchema.Tool tool : result.tools()) {
                tools.add(new ToolDescriptor(tool.name(), tool.description(),
                        toJson(tool.inputSchema()), serverId));
            }
            return tools;
        }

        @Override
        public ToolCallResult callTool(String toolName, Map<String, Object> arguments) {
            McpSchema.CallToolResult result = client.callTool(
                    new McpSchema.CallToolRequest(toolName, arguments != null ? arguments : Map.of()));

            List<ToolCallResult.Content> content = new ArrayList<>();
            if (result.content() != null) {
                for (McpSchema.Content item : result.content()) {
                    if (item instanceof McpSchema.TextContent text) {
                        content.add(new ToolCallResult.Content(text.text()));
                    } else {
                        content.add(new ToolCallResult.Content(toJson(item)));
                    }
                }
            }
            boolean failed = Boolean.TRUE.equals(result.isError());
            return new ToolCallResult(content, !failed);
        }

        @Override
        public void close() {
            closeQuietly(serverId, client);
        }

        private String toJson(Object value) {
            if (value == null) {
                return null;
            }
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                log.warn("Could not serialize MCP payload from server '{}': {}", serverId, e.getMessage());
                return null;
            }
        }
    }
}
