package io.cortexr.channel;

import io.cortexr.memory.IndexHit;
import io.cortexr.memory.IndexUnavailableException;
import io.cortexr.memory.MemoryIndex;
import io.cortexr.tool.ToolDescriptor;
import io.cortexr.tool.ToolDispatcher;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API channel for the agent.
 */
@RestController
@RequestMapping("/api")
public class AgentController {

    private final AgentService agentService;
    private final ToolDispatcher dispatcher;
    private final MemoryIndex memoryIndex;

    public AgentController(AgentService agentService, ToolDispatcher dispatcher, MemoryIndex memoryIndex) {
        this.agentService = agentService;
        this.dispatcher = dispatcher;
        this.memoryIndex = memoryIndex;
    }

    /**
     * Runs a query through the agent and returns its answer.
     */
    @PostMapping("/agent/query")
    public ResponseEntity<QueryResponseDto> query(@RequestBody QueryRequestDto request) {
        AgentService.QueryResult result = agentService.handle(request.query());
        return ResponseEntity.ok(new QueryResponseDto(
                result.answer(), result.complete(), result.rejected(), result.sessionId(), result.steps()));
    }

    @GetMapping("/tools")
    public ResponseEntity<List<ToolDto>> tools() {
        return ResponseEntity.ok(dispatcher.getAllTools().stream()
                .map(ToolDto::from)
                .toList());
    }

    @GetMapping("/tools/servers")
    public ResponseEntity<List<ToolDispatcher.ServerStatus>> servers() {
        return ResponseEntity.ok(dispatcher.getStatuses());
    }

    /**
     * Searches past conversations by similarity.
     */
    @GetMapping("/memory/search")
    public ResponseEntity<List<MemoryHitDto>> searchMemory(@RequestParam String query,
                                                           @RequestParam(defaultValue = "3") int k) {
        if (query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        return ResponseEntity.ok(memoryIndex.search(query, k).stream()
                .map(MemoryHitDto::from)
                .toList());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "cortex-r",
                "tools", dispatcher.getAllToolNames().size()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IndexUnavailableException.class)
    public ResponseEntity<Map<String, String>> indexUnavailable(IndexUnavailableException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
    }

    // --- DTOs ---

    public record QueryRequestDto(String query) {}

    public record QueryResponseDto(String answer, boolean complete, boolean rejected, String sessionId, int steps) {}

    public record ToolDto(String name, String description, String server) {
        static ToolDto from(ToolDescriptor tool) {
            return new ToolDto(tool.name(), tool.description(), tool.serverId());
        }
    }

    public record MemoryHitDto(String userQuery, String finalAnswer, String source, double distance) {
        static MemoryHitDto from(IndexHit hit) {
            return new MemoryHitDto(hit.entry().userQuery(), hit.entry().finalAnswer(),
                    hit.entry().sourceFile(), hit.distance());
        }
    }
}
