package io.cortexr.sandbox;

/**
 * Raised when plan code cannot be evaluated: a runtime type error, an undefined name,
 * a forbidden import or a missing attribute.
 */
public class PlanExecutionException extends RuntimeException {

    public PlanExecutionException(String message) {
        super(message);
    }

    public PlanExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
