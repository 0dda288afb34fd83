package io.cortexr.core;

import io.cortexr.config.CortexProperties;
import io.cortexr.memory.MemoryItem;
import io.cortexr.sandbox.PlanExecutor;
import io.cortexr.sandbox.SandboxResult;
import io.cortexr.sandbox.ToolCallListener;
import io.cortexr.tool.ToolCallRecord;
import io.cortexr.tool.ToolDescriptor;
import io.cortexr.tool.ToolDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * The agent's control loop: PERCEIVE → PLAN → EXECUTE → EVALUATE, then either the next step
 * or termination.
 *
 * <p>Each step:</p>
 * <ol>
 *   <li><strong>Perceive</strong>: the planner reads the input and names a tool hint and servers.
 *       An unparseable perception is replaced by one without a hint.</li>
 *   <li><strong>Plan</strong>: candidate tools are those of the selected servers (all tools when
 *       none are selected), narrowed to the names found in the hint.</li>
 *   <li><strong>Execute</strong>: the plan runs in the {@link PlanExecutor}. A failed run is retried
 *       up to {@code max-lifelines-per-step} times. After that the step is replanned, first with
 *       the tools that recently succeeded in this session (when memory fallback is enabled), then
 *       with the full catalogue.</li>
 *   <li><strong>Evaluate</strong>: the text is decoded once into a {@link StepOutcome}.</li>
 * </ol>
 *
 * <p>The step counter goes up by one per step; lifelines and forced replans inside a step do not
 * count. Reaching {@code max-steps} without a final answer ends the session as incomplete.</p>
 */
@Component
public class AgentLoop {

    private static final Logger log = LoggerFactory.getLogger(AgentLoop.class);

    static final int MEMORY_FALLBACK_LIMIT = 5;
    static final String INTERRUPTED = "interrupted";

    enum State { PERCEIVE, PLAN, EXECUTE, EVALUATE, TERMINATE }

    private final Planner planner;
    private final PlanExecutor executor;
    private final CortexProperties.Strategy strategy;

    public AgentLoop(Planner planner, PlanExecutor executor, CortexProperties properties) {
        this.planner = planner;
        this.executor = executor;
        this.strategy = properties.strategy();
    }

    /**
     * Runs a session to completion.
     *
     * @return the final answer, or the last text produced when the loop gave up
     */
    public AgentOutcome run(SessionContext context) {
        String input = context.getUserInput();
        String lastText = "";
        log.info("Session {} started (mode: {}, max steps: {})",
                context.getSessionId(), strategy.planningMode(), strategy.maxSteps());

        while (context.getStep() < strategy.maxSteps()) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Session {} interrupted after {} step(s)", context.getSessionId(), context.getStep());
                return finish(context, AgentOutcome.Status.INCOMPLETE, INTERRUPTED);
            }
            int step = context.advanceStep();

            transition(context, State.PERCEIVE);
            PerceptionResult perception = perceive(context, input);

            transition(context, State.PLAN);
            String text = planAndExecute(context, perception, input, step);
            lastText = text;

            transition(context, State.EVALUATE);
            StepOutcome outcome = StepOutcome.decode(text);
            if (outcome.isFinal()) {
                if (!outcome.marked()) {
                    log.info("Step {} returned unmarked text, treating it as the final answer", step);
                }
                transition(context, State.TERMINATE);
                return finish(context, AgentOutcome.Status.FINAL, outcome.text());
            }

            log.info("Step {} requires further processing", step);
            context.getMemory().add(MemoryItem.stepResult(context.getSessionId(), step, text));
            input = outcome.text();
        }

        log.warn("Session {} reached max steps ({}) without a final answer",
                context.getSessionId(), strategy.maxSteps());
        transition(context, State.TERMINATE);
        return finish(context, AgentOutcome.Status.INCOMPLETE, lastText);
    }

    // --- Phases ---

    private PerceptionResult perceive(SessionContext context, String input) {
        try {
            PerceptionResult perception = planner.perceive(input, context.getDispatcher().getServerDescriptors());
            log.debug("Perception: intent='{}', hint='{}', servers={}",
                    perception.intent(), perception.toolHint(), perception.selectedServers());
            return perception;
        } catch (PerceptionParseException e) {
            log.warn("Perception failed, continuing without a tool hint: {}", e.getMessage());
            return PerceptionResult.fallback(input);
        }
    }

    /**
     * Plans and executes one step, including lifelines and forced replans.
     * Returns the text to evaluate.
     */
    private String planAndExecute(SessionContext context, PerceptionResult perception, String input, int step) {
        ToolDispatcher dispatcher = context.getDispatcher();
        List<ToolDescriptor> candidates = candidateTools(dispatcher, perception);
        List<ToolDescriptor> narrowed = ToolCatalog.filterByHint(candidates, perception.toolHint());
        if (narrowed.isEmpty()) {
            log.debug("No tools matched hint '{}', offering {} candidate tool(s)",
                    perception.toolHint(), candidates.size());
            narrowed = candidates;
        }

        Attempt attempt = attempt(context, perception, input, step, narrowed, false);
        if (attempt.succeeded()) {
            return attempt.text();
        }

        Deque<List<ToolDescriptor>> replans = new ArrayDeque<>();
        if (strategy.memoryFallbackEnabled()) {
            List<ToolDescriptor> recent = recentSuccessfulTools(context);
            if (!recent.isEmpty()) {
                log.info("Memory fallback tools: {}", recent.stream().map(ToolDescriptor::name).toList());
                replans.add(recent);
            } else {
                log.info("No memory fallback tools in session log");
            }
        }
        replans.add(dispatcher.getAllTools());

        while (!replans.isEmpty()) {
            log.warn("Step {} failed, forcing a replan", step);
            attempt = attempt(context, perception, input, step, replans.poll(), true);
            if (attempt.succeeded()) {
                return attempt.text();
            }
        }
        log.warn("Step {} failed after all replans, returning the last error as the answer", step);
        return attempt.text();
    }

    private Attempt attempt(SessionContext context, PerceptionResult perception, String input,
                            int step, List<ToolDescriptor> tools, boolean forcedReplan) {
        PlanRequest request = new PlanRequest(input, perception, context.getMemory().getItems(),
                ToolCatalog.summarize(tools), step, strategy.maxSteps(), forcedReplan);
        String plan = planner.plan(request);
        if (!PlanExecutor.definesEntryPoint(plan)) {
            log.info("Planner returned text without solve(), evaluating it directly");
            return new Attempt(plan, true);
        }

        transition(context, State.EXECUTE);
        SandboxResult result = null;
        for (int lifeline = 0; lifeline <= strategy.maxLifelinesPerStep(); lifeline++) {
            if (lifeline > 0) {
                log.info("Step {}: retrying plan, lifeline {}/{}", step, lifeline, strategy.maxLifelinesPerStep());
            }
            result = executor.run(plan, context.getDispatcher(), new ProgressRecorder(context));
            if (result.isSuccess()) {
                return new Attempt(result.text(), true);
            }
            log.warn("Step {}: plan failed: {}", step, result.text());
            if (result.status() == SandboxResult.Status.EXHAUSTED) {
                break;
            }
        }
        return new Attempt(result.text(), false);
    }

    // --- Helpers ---

    private static List<ToolDescriptor> candidateTools(ToolDispatcher dispatcher, PerceptionResult perception) {
        if (perception.selectedServers().isEmpty()) {
            return dispatcher.getAllTools();
        }
        List<ToolDescriptor> selected = dispatcher.getToolsForServers(perception.selectedServers());
        return selected.isEmpty() ? dispatcher.getAllTools() : selected;
    }

    private static List<ToolDescriptor> recentSuccessfulTools(SessionContext context) {
        List<ToolDescriptor> tools = new ArrayList<>();
        for (String name : context.getMemory().recentSuccessfulTools(MEMORY_FALLBACK_LIMIT)) {
            ToolDescriptor tool = context.getDispatcher().getTool(name);
            if (tool != null) {
                tools.add(tool);
            }
        }
        return tools;
    }

    private AgentOutcome finish(SessionContext context, AgentOutcome.Status status, String text) {
        // Error sentinels are kept out of the index
        boolean success = status == AgentOutcome.Status.FINAL && !PlanExecutor.isErrorSentinel(text);
        context.setFinalAnswer(text);
        context.getMemory().add(MemoryItem.finalAnswer(context.getSessionId(), context.getUserQuery(), text, success));
        log.info("Session {} finished {} after {} step(s)", context.getSessionId(), status, context.getStep());
        return new AgentOutcome(status, text, context.getSessionId(), context.getStep());
    }

    private static void transition(SessionContext context, State state) {
        log.debug("[{}] step {} -> {}", context.getSessionId(), context.getStep(), state);
    }

    private record Attempt(String text, boolean succeeded) {
    }

    /**
     * Mirrors tool calls into task progress and the session log while a plan runs.
     */
    private static final class ProgressRecorder implements ToolCallListener {

        private final SessionContext context;
        private final Deque<Integer> pending = new ArrayDeque<>();

        ProgressRecorder(SessionContext context) {
            this.context = context;
        }

        @Override
        public void beforeCall(String toolName, Map<String, Object> arguments) {
            pending.add(context.addTaskProgress(toolName));
        }

        @Override
        public void afterCall(ToolCallRecord record) {
            Integer index = pending.poll();
            String status = record.success() ? SessionContext.STATUS_SUCCESS : SessionContext.STATUS_FAILURE;
            if (index != null) {
                context.updateTaskProgress(index, status);
            }
            context.getMemory().addToolOutput(record);
        }
    }
}
