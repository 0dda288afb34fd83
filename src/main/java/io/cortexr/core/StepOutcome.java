package io.cortexr.core;

/**
 * The decoded result of one step. The marker protocol is parsed here and nowhere else.
 *
 * <ul>
 *   <li>{@code FINAL_ANSWER: ...} ends the session with that answer.</li>
 *   <li>{@code FURTHER_PROCESSING_REQUIRED: ...} continues, feeding the remainder to the next step.</li>
 *   <li>Anything else is taken as a best-effort final answer.</li>
 * </ul>
 *
 * @param kind    final or continue
 * @param text    the text after the marker
 * @param marked  whether the text carried one of the two markers
 */
public record StepOutcome(Kind kind, String text, boolean marked) {

    public static final String FINAL_MARKER = "FINAL_ANSWER:";
    public static final String CONTINUE_MARKER = "FURTHER_PROCESSING_REQUIRED:";

    public enum Kind { FINAL, CONTINUE }

    public static StepOutcome decode(String raw) {
        String trimmed = raw == null ? "" : raw.strip();
        if (trimmed.startsWith(FINAL_MARKER)) {
            return new StepOutcome(Kind.FINAL, trimmed.substring(FINAL_MARKER.length()).strip(), true);
        }
        if (trimmed.startsWith(CONTINUE_MARKER)) {
            return new StepOutcome(Kind.CONTINUE, trimmed.substring(CONTINUE_MARKER.length()).strip(), true);
        }
        return new StepOutcome(Kind.FINAL, trimmed, false);
    }

    public boolean isFinal() {
        return kind == Kind.FINAL;
    }
}
