package io.cortexr.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StepOutcomeTest {

    @Test
    void shouldDecodeFinalAnswer() {
        StepOutcome outcome = StepOutcome.decode("FINAL_ANSWER: 120");

        assertTrue(outcome.isFinal());
        assertTrue(outcome.marked());
        assertEquals("120", outcome.text());
    }

    @Test
    void shouldDecodeContinuation() {
        StepOutcome outcome = StepOutcome.decode("  FURTHER_PROCESSING_REQUIRED: Page 1 says hello\nPage 2 says bye ");

        assertEquals(StepOutcome.Kind.CONTINUE, outcome.kind());
        assertEquals("Page 1 says hello\nPage 2 says bye", outcome.text());
    }

    @Test
    void shouldTreatUnmarkedTextAsFinal() {
        StepOutcome outcome = StepOutcome.decode("[sandbox error: division by zero]");

        assertTrue(outcome.isFinal());
        assertFalse(outcome.marked());
        assertEquals("[sandbox error: division by zero]", outcome.text());
    }

    @Test
    void shouldOnlyRecognizeLeadingMarker() {
        StepOutcome outcome = StepOutcome.decode("Result: FURTHER_PROCESSING_REQUIRED: x");

        assertTrue(outcome.isFinal());
        assertFalse(outcome.marked());
    }

    @Test
    void shouldHandleNullAndEmptyAnswer() {
        assertEquals("", StepOutcome.decode(null).text());
        assertEquals("", StepOutcome.decode("FINAL_ANSWER:").text());
    }
}
