package io.cortexr.core;

import java.util.List;

/**
 * The planner's reading of the current input.
 *
 * @param userInput       the input that was analysed
 * @param intent          the perceived intent
 * @param entities        key entities in the input
 * @param toolHint        free text naming tools that may help; tool names are matched against it
 * @param selectedServers ids of the tool servers considered relevant
 */
public record PerceptionResult(
        String userInput,
        String intent,
        List<String> entities,
        String toolHint,
        List<String> selectedServers
) {
    public PerceptionResult {
        entities = entities == null ? List.of() : List.copyOf(entities);
        selectedServers = selectedServers == null ? List.of() : List.copyOf(selectedServers);
        if (toolHint == null) {
            toolHint = "";
        }
        if (intent == null) {
            intent = "";
        }
    }

    /**
     * A perception with no hint and no server selection, used when the planner's answer
     * could not be parsed.
     */
    public static PerceptionResult fallback(String userInput) {
        return new PerceptionResult(userInput, "unknown", List.of(), "", List.of());
    }
}
