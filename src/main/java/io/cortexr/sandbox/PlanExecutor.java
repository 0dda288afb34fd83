package io.cortexr.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cortexr.config.CortexProperties;
import io.cortexr.tool.ToolDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Runs planner-generated plans.
 *
 * <p>A plan defines {@code solve()} (optionally {@code async}) and may call tools through
 * {@code mcp.call_tool(name, args)}. Each run gets a fresh interpreter and a fresh tool-call
 * budget. Nothing a plan does can throw out of {@link #run}: parse errors, runtime errors,
 * tool failures and budget exhaustion all come back as a {@link SandboxResult} whose text is
 * the {@code [sandbox error: ...]} sentinel.</p>
 *
 * <p>The returned value of {@code solve()} is normalized to text: a dict holding {@code result}
 * yields that value, any other dict is rendered as JSON, a list is joined with single spaces,
 * and anything else is stringified.</p>
 */
@Component
public class PlanExecutor {

    private static final Logger log = LoggerFactory.getLogger(PlanExecutor.class);

    public static final String ERROR_PREFIX = "[sandbox error: ";
    static final String ENTRY_POINT = "solve";

    private final int maxToolCalls;
    private final ObjectMapper objectMapper;

    public PlanExecutor(CortexProperties properties, ObjectMapper objectMapper) {
        this(properties.sandbox().maxToolCalls(), objectMapper);
    }

    PlanExecutor(int maxToolCalls, ObjectMapper objectMapper) {
        if (maxToolCalls < 1) {
            throw new IllegalArgumentException("cortex.sandbox.max-tool-calls must be at least 1");
        }
        this.maxToolCalls = maxToolCalls;
        this.objectMapper = objectMapper;
    }

    /**
     * Runs a plan against the given dispatcher.
     *
     * @param code       plan code defining {@code solve()}
     * @param dispatcher the dispatcher tool calls are routed through
     * @return the normalized result or an error sentinel; never null
     */
    public SandboxResult run(String code, ToolDispatcher dispatcher) {
        return run(code, dispatcher, ToolCallListener.NONE);
    }

    /**
     * Runs a plan, reporting each tool call to {@code listener} as it happens.
     */
    public SandboxResult run(String code, ToolDispatcher dispatcher, ToolCallListener listener) {
        log.debug("Running plan:\n{}", code);
        ToolCallProxy proxy = new ToolCallProxy(dispatcher, maxToolCalls, listener);
        try {
            PlanAst.Program program = PlanParser.parse(code == null ? "" : code);

            Map<String, Object> names = new HashMap<>();
            names.put("mcp", proxy);
            names.put("json", new JsonModule(objectMapper));
            names.put("re", new RegexModule());

            PlanInterpreter interpreter = new PlanInterpreter(names);
            interpreter.load(program);
            Object solve = interpreter.global(ENTRY_POINT);
            if (solve == null) {
                throw new PlanExecutionException("No solve() function found in plan.");
            }
            Object value = PlanInterpreter.await(interpreter.invoke(solve));

            String text = normalize(value);
            log.info("Plan completed with {} tool call(s)", proxy.callCount());
            return SandboxResult.ok(text, proxy.records());
        } catch (PlanResourceExhaustedException e) {
            log.warn("Plan aborted: {}", e.getMessage());
            return SandboxResult.error(SandboxResult.Status.EXHAUSTED, e.getMessage(), proxy.records());
        } catch (RuntimeException e) {
            log.warn("Plan execution error: {}", e.getMessage());
            log.debug("Plan execution error detail", e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return SandboxResult.error(SandboxResult.Status.ERROR, message, proxy.records());
        } catch (StackOverflowError e) {
            log.warn("Plan execution error: stack overflow");
            return SandboxResult.error(SandboxResult.Status.ERROR, "maximum recursion depth exceeded", proxy.records());
        }
    }

    /**
     * Whether the text is an error sentinel produced by {@link #run}.
     */
    public static boolean isErrorSentinel(String text) {
        return text != null && text.startsWith(ERROR_PREFIX);
    }

    /**
     * Whether the text contains a plan entry point.
     */
    public static boolean definesEntryPoint(String code) {
        return code != null && code.matches("(?s).*\\bdef\\s+" + ENTRY_POINT + "\\s*\\(.*");
    }

    String normalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            if (map.containsKey("result")) {
                return PlanValues.str(map.get("result"));
            }
            try {
                return objectMapper.writeValueAsString(map);
            } catch (JsonProcessingException e) {
                throw new PlanExecutionException("could not serialize result: " + e.getOriginalMessage());
            }
        }
        if (value instanceof List<?> list) {
            StringJoiner joiner = new StringJoiner(" ");
            for (Object item : list) {
                joiner.add(PlanValues.str(item));
            }
            return joiner.toString();
        }
        return PlanValues.str(value);
    }
}
