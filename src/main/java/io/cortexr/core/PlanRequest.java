package io.cortexr.core;

import io.cortexr.memory.MemoryItem;

import java.util.List;

/**
 * Everything the planner needs to write one plan.
 *
 * @param userInput        the current input (the original query, or a continuation)
 * @param perception       result of the perceive phase
 * @param memoryItems      the session log so far
 * @param toolDescriptions one {@code - name: description} line per candidate tool
 * @param step             1-based step number
 * @param maxSteps         configured step limit
 * @param forcedReplan     whether earlier plans for this step failed
 */
public record PlanRequest(
        String userInput,
        PerceptionResult perception,
        List<MemoryItem> memoryItems,
        String toolDescriptions,
        int step,
        int maxSteps,
        boolean forcedReplan
) {
    public PlanRequest {
        memoryItems = memoryItems == null ? List.of() : List.copyOf(memoryItems);
    }
}
