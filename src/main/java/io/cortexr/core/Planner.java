package io.cortexr.core;

import io.cortexr.tool.ServerDescriptor;

import java.util.List;

/**
 * The language model side of the agent loop.
 */
public interface Planner {

    /**
     * Analyses the input and picks a tool hint and relevant servers.
     *
     * @throws PerceptionParseException if the answer is not a valid perception
     */
    PerceptionResult perceive(String input, List<ServerDescriptor> servers);

    /**
     * Writes plan code defining {@code solve()}, or returns a {@code FINAL_ANSWER:} line
     * when no valid plan could be produced.
     */
    String plan(PlanRequest request);
}
