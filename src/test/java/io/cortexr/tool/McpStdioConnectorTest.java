package io.cortexr.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class McpStdioConnectorTest {

    private final McpStdioConnector connector = new McpStdioConnector(new ObjectMapper());

    @Test
    void shouldRejectServerWithoutCommand() {
        var server = new ServerDescriptor("math", " ", List.of(), null, "math");
        var e = assertThrows(IllegalStateException.class, () -> connector.createTransport(server));
        assertTrue(e.getMessage().contains("requires a 'command'"));
    }

    @Test
    void shouldRejectMissingWorkingDirectory(@TempDir Path tempDir) {
        var server = new ServerDescriptor("math", "python", List.of("server.py"),
                tempDir.resolve("missing").toString(), "math");
        var e = assertThrows(IllegalStateException.class, () -> McpStdioConnector.resolveWorkingDirectory(server));
        assertTrue(e.getMessage().contains("does not exist"));
    }

    @Test
    void shouldResolveExistingWorkingDirectory(@TempDir Path tempDir) {
        var server = new ServerDescriptor("math", "python", List.of("server.py"), tempDir.toString(), "math");
        assertEquals(tempDir.toFile(), McpStdioConnector.resolveWorkingDirectory(server));
    }

    @Test
    void shouldUseCurrentDirectoryWhenNoneConfigured() {
        var server = new ServerDescriptor("math", "python", List.of("server.py"), null, "math");
        assertNull(McpStdioConnector.resolveWorkingDirectory(server));
    }

    @Test
    void shouldBuildTransportForValidServer() {
        var server = new ServerDescriptor("math", "python", List.of("server.py"), null, "math");
        assertNotNull(connector.createTransport(server));
    }
}
