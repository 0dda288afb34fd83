package io.cortexr.security;

/**
 * Outcome of {@link InputHeuristics#apply(String)}.
 *
 * @param allowed          whether the input may be processed
 * @param sanitized        the cleaned input, null when rejected
 * @param rejectionMessage the message shown to the user, null when allowed
 */
public record HeuristicResult(boolean allowed, String sanitized, String rejectionMessage) {

    public static HeuristicResult allow(String sanitized) {
        return new HeuristicResult(true, sanitized, null);
    }

    public static HeuristicResult reject(String message) {
        return new HeuristicResult(false, null, message);
    }
}
