package io.cortexr.config;

import io.cortexr.tool.ServerDescriptor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Configuration properties for the agent.
 *
 * <p>Binds to {@code cortex.*} in application.yml:</p>
 * <pre>
 * cortex:
 *   tool-servers:
 *     - id: math
 *       command: python
 *       args: ["mcp_server_1.py", "--stdio"]
 *       description: Arithmetic tools
 *   strategy:
 *     planning-mode: exploratory
 *     max-steps: 3
 *     max-lifelines-per-step: 3
 *     memory-fallback-enabled: true
 *   sandbox:
 *     max-tool-calls: 5
 *   memory:
 *     sessions-dir: ./data/memory
 *     index-dir: ./data/memory_index
 * </pre>
 */
@ConfigurationProperties(prefix = "cortex")
public record CortexProperties(
        List<ServerDescriptor> toolServers,
        Strategy strategy,
        Sandbox sandbox,
        Memory memory
) {

    public CortexProperties {
        if (toolServers == null) {
            toolServers = List.of();
        }
        if (strategy == null) {
            strategy = new Strategy(null, null, null, null);
        }
        if (sandbox == null) {
            sandbox = new Sandbox(null);
        }
        if (memory == null) {
            memory = new Memory(null, null, null, null, null, null);
        }
    }

    /**
     * Control loop strategy.
     *
     * @param planningMode          "conservative" or "exploratory" (selects the decision prompt)
     * @param maxSteps              PLAN+EXECUTE attempts before the session ends incomplete
     * @param maxLifelinesPerStep   execute retries per step before a forced replan
     * @param memoryFallbackEnabled replan first with recently successful tools from the session log
     */
    public record Strategy(
            String planningMode,
            Integer maxSteps,
            Integer maxLifelinesPerStep,
            Boolean memoryFallbackEnabled
    ) {
        public Strategy {
            if (planningMode == null || planningMode.isBlank()) {
                planningMode = "conservative";
            }
            if (maxSteps == null) {
                maxSteps = 3;
            }
            if (maxLifelinesPerStep == null) {
                maxLifelinesPerStep = 3;
            }
            if (memoryFallbackEnabled == null) {
                memoryFallbackEnabled = false;
            }
            if (maxSteps < 1) {
                throw new IllegalArgumentException("cortex.strategy.max-steps must be at least 1");
            }
            if (maxLifelinesPerStep < 0) {
                throw new IllegalArgumentException("cortex.strategy.max-lifelines-per-step must not be negative");
            }
        }

        public boolean isExploratory() {
            return "exploratory".equalsIgnoreCase(planningMode);
        }
    }

    /**
     * @param maxToolCalls ceiling on tool calls per plan
     */
    public record Sandbox(Integer maxToolCalls) {
        public Sandbox {
            if (maxToolCalls == null) {
                maxToolCalls = 5;
            }
        }
    }

    /**
     * Session log and similarity index settings.
     *
     * @param sessionsDir                root of the date-partitioned session logs
     * @param indexDir                   directory holding the vector file and metadata sidecar
     * @param injectionMaxResults        candidates considered for injection
     * @param injectionDistanceThreshold squared L2 distance at or above which a candidate is dropped
     * @param refreshIntervalMinutes     interval of the background index refresh job
     * @param refreshEnabled             whether the background refresh job is registered
     */
    public record Memory(
            String sessionsDir,
            String indexDir,
            Integer injectionMaxResults,
            Double injectionDistanceThreshold,
            Integer refreshIntervalMinutes,
            Boolean refreshEnabled
    ) {
        public Memory {
            if (sessionsDir == null || sessionsDir.isBlank()) {
                sessionsDir = "./data/memory";
            }
            if (indexDir == null || indexDir.isBlank()) {
                indexDir = "./data/memory_index";
            }
            if (injectionMaxResults == null) {
                injectionMaxResults = 2;
            }
            if (injectionDistanceThreshold == null) {
                injectionDistanceThreshold = 300.0;
            }
            if (refreshIntervalMinutes == null) {
                refreshIntervalMinutes = 5;
            }
            if (refreshEnabled == null) {
                refreshEnabled = true;
            }
        }
    }
}
