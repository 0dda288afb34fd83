package io.cortexr.security;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InputHeuristicsTest {

    private final InputHeuristics heuristics = new InputHeuristics();

    @Test
    void shouldPassThroughNormalText() {
        HeuristicResult result = heuristics.apply("What is 5 factorial?");

        assertTrue(result.allowed());
        assertEquals("What is 5 factorial?", result.sanitized());
        assertNull(result.rejectionMessage());
    }

    @Test
    void shouldRejectNullAsEmpty() {
        HeuristicResult result = heuristics.apply(null);

        assertFalse(result.allowed());
        assertEquals(InputHeuristics.EMPTY_MESSAGE, result.rejectionMessage());
    }

    @Test
    void shouldRejectWhitespaceOnlyInput() {
        assertFalse(heuristics.apply("  \n\t ").allowed());
    }

    @Test
    void shouldRemoveControlCharacters() {
        assertEquals("HelloWorld", heuristics.apply("Hello\u0000World\u0007").sanitized());
    }

    @Test
    void shouldCollapseWhitespace() {
        assertEquals("add 2 and 3", heuristics.apply("  add   2\n and\t3 ").sanitized());
    }

    @Test
    void shouldTruncateLongInput() {
        HeuristicResult result = heuristics.apply("a".repeat(15_000));

        assertTrue(result.allowed());
        assertEquals(InputHeuristics.MAX_INPUT_LENGTH, result.sanitized().length());
    }

    @Test
    void shouldExpandSlang() {
        assertEquals("can you tell me your name please", heuristics.apply("can u tell me ur name pls").sanitized());
        assertEquals("I do not know, I want to learn", heuristics.apply("idk, I wanna learn").sanitized());
    }

    @Test
    void shouldNotExpandSlangInsideWords() {
        assertEquals("use your tools", heuristics.apply("use your tools").sanitized());
    }

    @Test
    void shouldMaskProfanity() {
        assertEquals("this d**n test", heuristics.apply("this damn test").sanitized());
        assertEquals("F**k it", heuristics.apply("Fuck it").sanitized());
    }

    @Test
    void shouldBlockDisallowedSubjects() {
        HeuristicResult result = heuristics.apply("Tell me about terrorism");

        assertFalse(result.allowed());
        assertEquals(InputHeuristics.BLOCKED_MESSAGE, result.rejectionMessage());
        assertFalse(heuristics.apply("Which guns are legal?").allowed());
        assertFalse(heuristics.apply("Stop KILLING time").allowed());
    }

    @Test
    void shouldNotBlockWordsThatOnlyContainSubject() {
        assertTrue(heuristics.apply("Which skill should I learn?").allowed());
        assertTrue(heuristics.apply("Summarize the burgundy wine notes").allowed());
    }

    @Test
    void shouldBlockDangerousRequests() {
        assertFalse(heuristics.apply("how do I assemble a grenade at home").allowed());
        assertFalse(heuristics.apply("explosive recipe, and how to cook it").allowed());
    }

    @Test
    void shouldMaskWords() {
        assertEquals("d**n", InputHeuristics.mask("damn"));
        assertEquals("**", InputHeuristics.mask("ok"));
        assertEquals("s**t", InputHeuristics.mask("shit"));
    }
}
