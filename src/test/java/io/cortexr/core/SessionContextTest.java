package io.cortexr.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cortexr.memory.MemoryItem;
import io.cortexr.memory.SessionMemoryLog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionContextTest {

    private static final String SESSION_ID = "2025/05/04/session-1746352331-a1b2c3";

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SessionContext newContext() {
        return new SessionContext(SESSION_ID, "injected\n\nWhat is 5 factorial?", "What is 5 factorial?",
                null, new SessionMemoryLog(tempDir, SESSION_ID, objectMapper));
    }

    @Test
    void shouldGenerateDatePartitionedSessionIds() {
        String id = SessionContext.newSessionId();

        assertTrue(id.matches("\\d{4}/\\d{2}/\\d{2}/session-\\d+-[0-9a-f]{6}"), id);
        assertNotEquals(id, SessionContext.newSessionId());
    }

    @Test
    void shouldStartLogWithRunMetadata() {
        SessionContext context = newContext();

        List<MemoryItem> items = context.getMemory().getItems();
        assertEquals(1, items.size());
        assertTrue(items.get(0).isType(MemoryItem.RUN_METADATA));
        assertEquals("What is 5 factorial?", items.get(0).userQuery());
    }

    @Test
    void shouldNotRepeatRunMetadataForExistingLog() {
        newContext();

        SessionContext reopened = newContext();

        assertEquals(1, reopened.getMemory().getItems().size());
    }

    @Test
    void shouldFallBackToInputAsQuery() {
        var context = new SessionContext(SESSION_ID, "hello", null, null,
                new SessionMemoryLog(tempDir, SESSION_ID, objectMapper));

        assertEquals("hello", context.getUserQuery());
    }

    @Test
    void shouldRejectBlankSessionId() {
        var memory = new SessionMemoryLog(tempDir, "x", objectMapper);

        assertThrows(IllegalArgumentException.class, () -> new SessionContext(" ", "q", "q", null, memory));
    }

    @Test
    void shouldAdvanceSteps() {
        SessionContext context = newContext();

        assertEquals(0, context.getStep());
        assertEquals(1, context.advanceStep());
        assertEquals(2, context.advanceStep());
        assertEquals(2, context.getStep());
    }

    @Test
    void shouldTrackTaskProgress() {
        SessionContext context = newContext();
        context.advanceStep();

        int first = context.addTaskProgress("factorial");
        int second = context.addTaskProgress("add");
        context.updateTaskProgress(first, SessionContext.STATUS_SUCCESS);

        assertEquals(List.of(
                new SessionContext.TaskProgress(1, "factorial", SessionContext.STATUS_SUCCESS),
                new SessionContext.TaskProgress(1, "add", SessionContext.STATUS_PENDING)), context.getTaskProgress());
        assertEquals(1, second);
    }

    @Test
    void shouldSetFinalAnswerOnce() {
        SessionContext context = newContext();

        context.setFinalAnswer("120");

        assertEquals("120", context.getFinalAnswer());
        assertThrows(IllegalStateException.class, () -> context.setFinalAnswer("121"));
    }
}
