package io.cortexr.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.List;
import java.util.Map;

/**
 * The {@code json} module: {@code loads} and {@code dumps} backed by Jackson.
 */
final class JsonModule implements PlanModule {

    private final ObjectMapper objectMapper;

    JsonModule(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "json";
    }

    @Override
    public Object attribute(String attribute) {
        return switch (attribute) {
            case "loads" -> (PlanCallable) this::loads;
            case "dumps" -> (PlanCallable) this::dumps;
            default -> throw new PlanExecutionException("module 'json' has no attribute '" + attribute + "'");
        };
    }

    private Object loads(List<Object> args, Map<String, Object> kwargs) {
        if (args.size() != 1 || !(args.get(0) instanceof String text)) {
            throw new PlanExecutionException("json.loads() expects a single string argument");
        }
        try {
            return PlanValues.fromHost(objectMapper.readValue(text, Object.class));
        } catch (JsonProcessingException e) {
            throw new PlanExecutionException("invalid JSON: " + e.getOriginalMessage());
        }
    }

    private Object dumps(List<Object> args, Map<String, Object> kwargs) {
        if (args.size() != 1) {
            throw new PlanExecutionException("json.dumps() expects a single argument");
        }
        try {
            return PlanValues.truthy(kwargs.get("indent"))
                    ? objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(args.get(0))
                    : objectMapper.writeValueAsString(args.get(0));
        } catch (JsonProcessingException e) {
            throw new PlanExecutionException("object of type '" + PlanValues.typeName(args.get(0))
                    + "' is not JSON serializable");
        }
    }
}
