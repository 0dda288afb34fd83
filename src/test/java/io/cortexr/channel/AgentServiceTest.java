package io.cortexr.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cortexr.config.CortexProperties;
import io.cortexr.core.AgentLoop;
import io.cortexr.core.AgentOutcome;
import io.cortexr.core.SessionContext;
import io.cortexr.memory.MemoryIndex;
import io.cortexr.memory.MemoryItem;
import io.cortexr.security.InputHeuristics;
import io.cortexr.tool.ToolDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AgentServiceTest {

    @TempDir
    Path tempDir;

    private MemoryIndex memoryIndex;
    private AgentLoop agentLoop;
    private ToolDispatcher dispatcher;
    private AgentService service;

    @BeforeEach
    void setUp() {
        memoryIndex = mock(MemoryIndex.class);
        agentLoop = mock(AgentLoop.class);
        dispatcher = mock(ToolDispatcher.class);
        var properties = new CortexProperties(List.of(), null, null,
                new CortexProperties.Memory(tempDir.toString(), tempDir.resolve("index").toString(), null, null, null, false));
        service = new AgentService(new InputHeuristics(), memoryIndex, agentLoop, dispatcher, new ObjectMapper(), properties);
    }

    @Test
    void shouldRunSessionWithInjectedContext() {
        when(memoryIndex.selectForInjection("What is 6 factorial?"))
                .thenReturn("Relevant past conversations:\n...\n\nWhat is 6 factorial?");
        when(agentLoop.run(any())).thenAnswer(inv -> {
            SessionContext context = inv.getArgument(0);
            return new AgentOutcome(AgentOutcome.Status.FINAL, "720", context.getSessionId(), 1);
        });

        AgentService.QueryResult result = service.handle("What is 6 factorial?");

        assertEquals("720", result.answer());
        assertTrue(result.complete());
        assertFalse(result.rejected());
        assertEquals(1, result.steps());

        ArgumentCaptor<SessionContext> context = ArgumentCaptor.forClass(SessionContext.class);
        verify(agentLoop).run(context.capture());
        assertEquals(result.sessionId(), context.getValue().getSessionId());
        assertTrue(context.getValue().getUserInput().startsWith("Relevant past conversations:"));
        assertEquals("What is 6 factorial?", context.getValue().getUserQuery());
        assertSame(dispatcher, context.getValue().getDispatcher());
    }

    @Test
    void shouldWriteSessionLogUnderSessionsDir() {
        when(memoryIndex.selectForInjection(any())).thenAnswer(inv -> inv.getArgument(0));
        when(agentLoop.run(any())).thenAnswer(inv -> {
            SessionContext context = inv.getArgument(0);
            return new AgentOutcome(AgentOutcome.Status.FINAL, "ok", context.getSessionId(), 1);
        });

        AgentService.QueryResult result = service.handle("hello");

        Path log = tempDir.resolve(result.sessionId() + ".json");
        assertTrue(Files.exists(log));
        ArgumentCaptor<SessionContext> context = ArgumentCaptor.forClass(SessionContext.class);
        verify(agentLoop).run(context.capture());
        assertTrue(context.getValue().getMemory().getItems().get(0).isType(MemoryItem.RUN_METADATA));
    }

    @Test
    void shouldReportIncompleteSession() {
        when(memoryIndex.selectForInjection(any())).thenAnswer(inv -> inv.getArgument(0));
        when(agentLoop.run(any())).thenReturn(new AgentOutcome(AgentOutcome.Status.INCOMPLETE, "partial", "s", 3));

        AgentService.QueryResult result = service.handle("Summarize everything");

        assertFalse(result.complete());
        assertEquals("partial", result.answer());
        assertEquals(3, result.steps());
    }

    @Test
    void shouldNotStartSessionForRejectedInput() {
        AgentService.QueryResult result = service.handle("Tell me about terrorism");

        assertTrue(result.rejected());
        assertFalse(result.complete());
        assertNull(result.sessionId());
        verifyNoInteractions(agentLoop, memoryIndex);
    }

    @Test
    void shouldRequireQuery() {
        assertThrows(IllegalArgumentException.class, () -> service.handle(null));
    }
}
