package io.cortexr.tool;

import io.cortexr.config.CortexProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes tool calls by name to the tool server that owns the tool.
 *
 * <ol>
 *   <li><strong>Discovery</strong>: {@link #initialize()} opens one session per configured server,
 *       lists its tools and records tool name → server. A failing server is logged and skipped.</li>
 *   <li><strong>Dispatch</strong>: {@link #callTool} opens a fresh session with the owning server
 *       for every call and closes it afterwards, success or failure.</li>
 * </ol>
 *
 * <p>The tool map is built once during startup and is read-only afterwards. When two servers advertise the same tool name the
 * server registered last wins.</p>
 */
@Component
@EnableConfigurationProperties(CortexProperties.class)
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final List<ServerDescriptor> serverDescriptors;
    private final ToolServerConnector connector;

    private volatile Map<String, ToolDescriptor> toolMap = Map.of();
    private volatile Map<String, ServerStatus> statuses = Map.of();

    public ToolDispatcher(CortexProperties properties, ToolServerConnector connector) {
        this.serverDescriptors = List.copyOf(properties.toolServers());
        this.connector = connector;
    }

    /**
     * Discovers tools on every enabled server.
     *
     * @throws IllegalStateException if no enabled tool server is configured
     */
    @PostConstruct
    public void initialize() {
        List<ServerDescriptor> enabled = getServerDescriptors();
        if (enabled.isEmpty()) {
            throw new IllegalStateException("No tool servers configured under cortex.tool-servers");
        }

        Map<String, ToolDescriptor> tools = new LinkedHashMap<>();
        Map<String, ServerStatus> discovered = new LinkedHashMap<>();

        for (ServerDescriptor server : enabled) {
            if (server.id() == null || server.id().isBlank()) {
                log.warn("Tool server config missing 'id', skipping");
                continue;
            }
            try (ToolServerConnector.Session session = connector.open(server)) {
                List<String> names = new ArrayList<>();
                for (ToolDescriptor tool : session.listTools()) {
                    ToolDescriptor previous = tools.remove(tool.name());
                    if (previous != null) {
                        log.warn("Tool '{}' from server '{}' replaces the one from server '{}'",
                                tool.name(), server.id(), previous.serverId());
                    }
                    tools.put(tool.name(), tool);
                    names.add(tool.name());
                    log.debug("Registered tool '{}' from server '{}'", tool.name(), server.id());
                }
                discovered.put(server.id(), new ServerStatus(server.id(), true, names));
            } catch (Exception e) {
                log.error("Failed to discover tools on server '{}': {}", server.id(), e.getMessage());
                discovered.put(server.id(), new ServerStatus(server.id(), false, List.of()));
            }
        }

        this.toolMap = Collections.unmodifiableMap(tools);
        this.statuses = Collections.unmodifiableMap(discovered);
        logSummary();
    }

    // --- Dispatch ---

    /**
     * Calls a tool on its owning server over a call-scoped connection.
     *
     * @param toolName  the tool to call
     * @param arguments tool arguments
     * @return the raw result payload; {@code success} is false when the tool reported an error
     * @throws ToolNotFoundException   if no server owns the tool
     * @throws ToolInvocationException if the server could not be reached or the call failed in transport
     */
    public ToolCallResult callTool(String toolName, Map<String, Object> arguments) {
        ToolDescriptor tool = toolMap.get(toolName);
        if (tool == null) {
            throw new ToolNotFoundException(toolName);
        }
        ServerDescriptor server = findServer(tool.serverId());

        log.debug("Calling tool '{}' on server '{}'", toolName, server.id());
        try (ToolServerConnector.Session session = connector.open(server)) {
            return session.callTool(toolName, arguments != null ? arguments : Map.of());
        } catch (RuntimeException e) {
            throw new ToolInvocationException(toolName, server.id(), e);
        }
    }

    // --- Read API ---

    /**
     * Returns the enabled server descriptors in configuration order.
     */
    public List<ServerDescriptor> getServerDescriptors() {
        return serverDescriptors.stream()
                .filter(ServerDescriptor::isEnabled)
                .toList();
    }

    /**
     * Returns every registered tool.
     */
    public List<ToolDescriptor> getAllTools() {
        return List.copyOf(toolMap.values());
    }

    /**
     * Returns all registered tool names.
     */
    public List<String> getAllToolNames() {
        return List.copyOf(toolMap.keySet());
    }

    /**
     * Returns the descriptor for a tool, or null if not registered.
     */
    public ToolDescriptor getTool(String toolName) {
        return toolMap.get(toolName);
    }

    /**
     * Returns the tools owned by the given servers. Unknown ids are ignored.
     */
    public List<ToolDescriptor> getToolsForServers(Collection<String> serverIds) {
        return toolMap.values().stream()
                .filter(t -> serverIds.contains(t.serverId()))
                .toList();
    }

    /**
     * Returns the tools owned by one server.
     */
    public List<ToolDescriptor> getToolsForServer(String serverId) {
        return getToolsForServers(List.of(serverId));
    }

    /**
     * Returns the discovery status of every server.
     */
    public List<ServerStatus> getStatuses() {
        return List.copyOf(statuses.values());
    }

    // --- Internal ---

    private ServerDescriptor findServer(String serverId) {
        for (ServerDescriptor server : serverDescriptors) {
            if (serverId.equals(server.id())) {
                return server;
            }
        }
        throw new IllegalStateException("Tool map refers to unknown server '" + serverId + "'");
    }

    private void logSummary() {
        long connected = statuses.values().stream().filter(ServerStatus::discovered).count();
        log.info("Tool servers: {}/{} discovered, {} tools registered",
                connected, statuses.size(), toolMap.size());
        for (ServerStatus status : statuses.values()) {
            if (status.discovered()) {
                log.info("  [OK] {}: {} tools {}", status.serverId(), status.toolNames().size(), status.toolNames());
            } else {
                log.warn("  [FAIL] {}: discovery failed", status.serverId());
            }
        }
    }

    /**
     * Discovery status of one server. {@code toolNames} lists the tools it advertised,
     * including names later taken over by another server.
     */
    public record ServerStatus(String serverId, boolean discovered, List<String> toolNames) {
        public ServerStatus {
            toolNames = toolNames == null ? List.of() : List.copyOf(toolNames);
        }
    }
}
