package io.cortexr.sandbox;

/**
 * Raised when a plan attempts more tool calls than its budget allows.
 * The attempt that crosses the ceiling is never dispatched, and plan code cannot catch this.
 */
public class PlanResourceExhaustedException extends RuntimeException {

    private final int limit;

    public PlanResourceExhaustedException(int limit) {
        super("Exceeded tool call limit of " + limit);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
