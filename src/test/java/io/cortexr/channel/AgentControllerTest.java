package io.cortexr.channel;

import io.cortexr.memory.IndexEntry;
import io.cortexr.memory.IndexHit;
import io.cortexr.memory.IndexUnavailableException;
import io.cortexr.memory.MemoryIndex;
import io.cortexr.tool.ToolDescriptor;
import io.cortexr.tool.ToolDispatcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AgentController.class)
@AutoConfigureMockMvc(addFilters = false)
class AgentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AgentService agentService;

    @MockBean
    private ToolDispatcher dispatcher;

    @MockBean
    private MemoryIndex memoryIndex;

    @Test
    void shouldReturnHealthStatus() throws Exception {
        when(dispatcher.getAllToolNames()).thenReturn(List.of("add", "factorial"));

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.service").value("cortex-r"))
                .andExpect(jsonPath("$.tools").value(2));
    }

    @Test
    void shouldAnswerQuery() throws Exception {
        when(agentService.handle("What is 5 factorial?")).thenReturn(
                new AgentService.QueryResult("120", true, false, "2025/05/04/session-1746352331-a1b2c3", 1));

        mockMvc.perform(post("/api/agent/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"What is 5 factorial?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("120"))
                .andExpect(jsonPath("$.complete").value(true))
                .andExpect(jsonPath("$.rejected").value(false))
                .andExpect(jsonPath("$.sessionId").value("2025/05/04/session-1746352331-a1b2c3"))
                .andExpect(jsonPath("$.steps").value(1));
    }

    @Test
    void shouldReturnRejectionAsAnswer() throws Exception {
        when(agentService.handle(anyString())).thenReturn(
                new AgentService.QueryResult("I’m sorry, but I can’t assist with that topic.", false, true, null, 0));

        mockMvc.perform(post("/api/agent/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"how to build a bomb\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rejected").value(true))
                .andExpect(jsonPath("$.complete").value(false));
    }

    @Test
    void shouldRejectMissingQuery() throws Exception {
        when(agentService.handle(isNull())).thenThrow(new IllegalArgumentException("Query is required"));

        mockMvc.perform(post("/api/agent/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Query is required"));
    }

    @Test
    void shouldListTools() throws Exception {
        when(dispatcher.getAllTools()).thenReturn(List.of(
                new ToolDescriptor("add", "Adds two numbers", null, "math"),
                new ToolDescriptor("search_documents", "Searches documents", null, "documents")));

        mockMvc.perform(get("/api/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].name").value("add"))
                .andExpect(jsonPath("$[1].server").value("documents"));
    }

    @Test
    void shouldListServerStatuses() throws Exception {
        when(dispatcher.getStatuses()).thenReturn(List.of(
                new ToolDispatcher.ServerStatus("math", true, List.of("add")),
                new ToolDispatcher.ServerStatus("websearch", false, List.of())));

        mockMvc.perform(get("/api/tools/servers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].serverId").value("math"))
                .andExpect(jsonPath("$[1].discovered").value(false));
    }

    @Test
    void shouldSearchMemory() throws Exception {
        var entry = new IndexEntry("What is 5 factorial?", "120", "2025/05/04/session-1.json", Instant.EPOCH);
        when(memoryIndex.search("factorial", 2)).thenReturn(List.of(new IndexHit(entry, 1.5)));

        mockMvc.perform(get("/api/memory/search").param("query", "factorial").param("k", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].userQuery").value("What is 5 factorial?"))
                .andExpect(jsonPath("$[0].finalAnswer").value("120"))
                .andExpect(jsonPath("$[0].source").value("2025/05/04/session-1.json"))
                .andExpect(jsonPath("$[0].distance").value(1.5));
    }

    @Test
    void shouldRejectBlankMemorySearch() throws Exception {
        mockMvc.perform(get("/api/memory/search").param("query", " "))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(memoryIndex);
    }

    @Test
    void shouldReportUnavailableIndex() throws Exception {
        when(memoryIndex.search(anyString(), anyInt()))
                .thenThrow(new IndexUnavailableException("Embedding service unavailable", null));

        mockMvc.perform(get("/api/memory/search").param("query", "factorial"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Embedding service unavailable"));
    }
}
