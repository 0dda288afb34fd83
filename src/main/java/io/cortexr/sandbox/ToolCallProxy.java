package io.cortexr.sandbox;

import io.cortexr.tool.ToolCallRecord;
import io.cortexr.tool.ToolCallResult;
import io.cortexr.tool.ToolDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The {@code mcp} object seen by plan code. {@code mcp.call_tool(name, args)} is the only way a
 * plan can reach the outside world. Calls are counted against a fixed budget and every attempt
 * is recorded, failed ones included.
 */
final class ToolCallProxy implements PlanModule {

    private static final Logger log = LoggerFactory.getLogger(ToolCallProxy.class);
    private static final int PREVIEW_LENGTH = 120;

    private final ToolDispatcher dispatcher;
    private final int maxCalls;
    private final ToolCallListener listener;
    private final List<ToolCallRecord> records = new ArrayList<>();
    private int callCount;

    ToolCallProxy(ToolDispatcher dispatcher, int maxCalls, ToolCallListener listener) {
        this.dispatcher = dispatcher;
        this.maxCalls = maxCalls;
        this.listener = listener;
    }

    @Override
    public String name() {
        return "mcp";
    }

    @Override
    public Object attribute(String attribute) {
        if ("call_tool".equals(attribute)) {
            return (PlanCallable) this::callTool;
        }
        throw new PlanExecutionException("'mcp' has no attribute '" + attribute + "'");
    }

    List<ToolCallRecord> records() {
        return Collections.unmodifiableList(records);
    }

    int callCount() {
        return callCount;
    }

    private Object callTool(List<Object> args, Map<String, Object> kwargs) {
        Object nameArg = args.isEmpty() ? kwargs.get("tool_name") : args.get(0);
        Object inputArg = args.size() > 1 ? args.get(1) : kwargs.getOrDefault("input_dict", kwargs.get("arguments"));
        if (!(nameArg instanceof String toolName)) {
            throw new PlanExecutionException("mcp.call_tool() expects a tool name string");
        }
        Map<String, Object> arguments = toArguments(inputArg);

        callCount++;
        if (callCount > maxCalls) {
            log.warn("Plan exceeded tool call limit of {} (attempted '{}')", maxCalls, toolName);
            throw new PlanResourceExhaustedException(maxCalls);
        }

        listener.beforeCall(toolName, arguments);
        ToolCallResult result;
        try {
            result = dispatcher.callTool(toolName, arguments);
        } catch (RuntimeException e) {
            record(ToolCallRecord.failed(toolName, arguments, e.getMessage()));
            throw e;
        }
        record(ToolCallRecord.of(toolName, arguments, result));

        String preview = result.firstText();
        if (preview.length() > PREVIEW_LENGTH) {
            preview = preview.substring(0, PREVIEW_LENGTH);
        }
        log.info("Tool '{}' returned preview: {}", toolName, preview);
        return PlanValues.fromHost(result.toPayload());
    }

    private void record(ToolCallRecord call) {
        records.add(call);
        listener.afterCall(call);
    }

    private static Map<String, Object> toArguments(Object input) {
        if (input == null) {
            return Map.of();
        }
        if (!(input instanceof Map<?, ?> map)) {
            throw new PlanExecutionException("mcp.call_tool() arguments must be a dict, got '"
                    + PlanValues.typeName(input) + "'");
        }
        Map<String, Object> arguments = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            arguments.put(PlanValues.str(entry.getKey()), entry.getValue());
        }
        return arguments;
    }
}
