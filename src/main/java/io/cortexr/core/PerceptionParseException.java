package io.cortexr.core;

/**
 * Thrown when the planner's perception output is not the expected JSON object.
 */
public class PerceptionParseException extends RuntimeException {

    public PerceptionParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
