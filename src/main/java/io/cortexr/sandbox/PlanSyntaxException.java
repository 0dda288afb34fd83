package io.cortexr.sandbox;

/**
 * Raised when plan code does not parse.
 */
public class PlanSyntaxException extends PlanExecutionException {

    private final int line;

    public PlanSyntaxException(String message, int line) {
        super(message + " (line " + line + ")");
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
