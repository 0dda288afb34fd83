package io.cortexr.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cortexr.config.CortexProperties;
import io.cortexr.core.AgentLoop;
import io.cortexr.core.AgentOutcome;
import io.cortexr.core.SessionContext;
import io.cortexr.memory.MemoryIndex;
import io.cortexr.memory.SessionMemoryLog;
import io.cortexr.security.HeuristicResult;
import io.cortexr.security.InputHeuristics;
import io.cortexr.tool.ToolDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Runs one user query through the agent: input heuristics, memory injection, then a fresh
 * session on the {@link AgentLoop}.
 */
@Service
public class AgentService {

    private static final Logger log = LoggerFactory.getLogger(AgentService.class);

    private final InputHeuristics heuristics;
    private final MemoryIndex memoryIndex;
    private final AgentLoop agentLoop;
    private final ToolDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final Path sessionsDir;

    public AgentService(InputHeuristics heuristics, MemoryIndex memoryIndex, AgentLoop agentLoop,
                        ToolDispatcher dispatcher, ObjectMapper objectMapper, CortexProperties properties) {
        this.heuristics = heuristics;
        this.memoryIndex = memoryIndex;
        this.agentLoop = agentLoop;
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
        this.sessionsDir = Path.of(properties.memory().sessionsDir());
    }

    /**
     * Answers a query. A query rejected by the heuristics starts no session.
     *
     * @throws IllegalArgumentException if the query is null
     */
    public QueryResult handle(String query) {
        if (query == null) {
            throw new IllegalArgumentException("Query is required");
        }
        HeuristicResult checked = heuristics.apply(query);
        if (!checked.allowed()) {
            return QueryResult.rejected(checked.rejectionMessage());
        }

        String input = memoryIndex.selectForInjection(checked.sanitized());
        String sessionId = SessionContext.newSessionId();
        log.info("Starting session {}", sessionId);

        SessionMemoryLog memory = new SessionMemoryLog(sessionsDir, sessionId, objectMapper);
        SessionContext context = new SessionContext(sessionId, input, checked.sanitized(), dispatcher, memory);
        AgentOutcome outcome = agentLoop.run(context);
        return new QueryResult(outcome.text(), outcome.isComplete(), false, sessionId, outcome.steps());
    }

    /**
     * @param answer    the final answer, the last text produced, or the rejection message
     * @param complete  whether the session ended with a final answer
     * @param rejected  whether the input heuristics rejected the query
     * @param sessionId the session id, null when rejected
     * @param steps     steps taken
     */
    public record QueryResult(String answer, boolean complete, boolean rejected, String sessionId, int steps) {

        static QueryResult rejected(String message) {
            return new QueryResult(message, false, true, null, 0);
        }
    }
}
