package io.cortexr.core;

import io.cortexr.tool.ToolDescriptor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Helpers for narrowing and describing the tools offered to the planner.
 */
public final class ToolCatalog {

    private ToolCatalog() {
    }

    /**
     * Keeps the tools whose name occurs in the hint. A blank hint keeps nothing.
     */
    public static List<ToolDescriptor> filterByHint(List<ToolDescriptor> tools, String hint) {
        if (hint == null || hint.isBlank()) {
            return List.of();
        }
        return tools.stream()
                .filter(tool -> hint.contains(tool.name()))
                .toList();
    }

    /**
     * One {@code - name: description} line per tool.
     */
    public static String summarize(List<ToolDescriptor> tools) {
        return tools.stream()
                .map(ToolDescriptor::summaryLine)
                .collect(Collectors.joining("\n"));
    }
}
