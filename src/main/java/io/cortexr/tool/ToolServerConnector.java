package io.cortexr.tool;

import java.util.List;
import java.util.Map;

/**
 * Opens sessions with tool server processes. Every session owns its own process
 * and must be closed by the caller.
 */
public interface ToolServerConnector {

    /**
     * Starts the server process and completes the protocol handshake.
     *
     * @param server the server to connect to
     * @return an initialized session
     */
    Session open(ServerDescriptor server);

    /**
     * A live, initialized session with one tool server.
     */
    interface Session extends AutoCloseable {

        /** Lists the tools the server advertises. */
        List<ToolDescriptor> listTools();

        /** Calls a tool and returns its raw payload. */
        ToolCallResult callTool(String toolName, Map<String, Object> arguments);

        /** Shuts the session and its process down. Never throws. */
        @Override
        void close();
    }
}
