package io.cortexr.core;

/**
 * How a session ended.
 *
 * @param status    FINAL when an answer was reached, INCOMPLETE when the loop gave up
 * @param text      the answer, or the last text produced
 * @param sessionId the session
 * @param steps     steps taken
 */
public record AgentOutcome(Status status, String text, String sessionId, int steps) {

    public enum Status { FINAL, INCOMPLETE }

    public boolean isComplete() {
        return status == Status.FINAL;
    }
}
