package io.cortexr.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class PlanInterpreterTest {

    private static Object solve(String code) {
        Map<String, Object> names = new HashMap<>();
        names.put("json", new JsonModule(new ObjectMapper()));
        names.put("re", new RegexModule());
        PlanInterpreter interpreter = new PlanInterpreter(names);
        interpreter.load(PlanParser.parse(code));
        return PlanInterpreter.await(interpreter.invoke(interpreter.global("solve")));
    }

    private static String result(String body) {
        return PlanValues.str(solve("def solve():\n" + body.indent(4)));
    }

    @Test
    void shouldUseExactIntegerArithmetic() {
        assertEquals("7", result("return 1 + 2 * 3"));
        assertEquals("3", result("return 7 // 2"));
        assertEquals("-4", result("return -7 // 2"));
        assertEquals("1", result("return -7 % 2"));
        assertEquals("1024", result("return 2 ** 10"));
        assertEquals("3.5", result("return 7 / 2"));
        assertEquals("120.0", result("return 120 * 1.0"));
    }

    @Test
    void shouldReportIntegerOverflow() {
        var e = assertThrows(PlanExecutionException.class, () -> result("return 2 ** 64"));
        assertEquals("integer overflow", e.getMessage());
    }

    @Test
    void shouldRepeatSequences() {
        assertEquals("ababab", result("return 'ab' * 3"));
        assertEquals("[1, 2, 1, 2]", result("return [1, 2] * 2"));
        assertEquals("", result("return 'ab' * -1"));
        assertEquals("[]", result("return [] * (2 ** 40)"));
    }

    @Test
    void shouldRejectOversizedRepetition() {
        var e = assertThrows(PlanExecutionException.class, () -> result("return 'a' * (2 ** 32 + 1)"));
        assertEquals("repeated sequence too long", e.getMessage());
        assertThrows(PlanExecutionException.class, () -> result("return [1, 2] * 6000000"));
        assertThrows(PlanExecutionException.class, () -> result("return (2 ** 31) * 'a'"));
    }

    @Test
    void shouldFormatFStrings() {
        assertEquals("x=3, pi=3.14, big=1,234,567", result("""
                x = 3
                return f"x={x}, pi={3.14159:.2f}, big={1234567:,}"
                """));
        assertEquals("{literal} 5", result("return f\"{{literal}} {2 + 3}\""));
    }

    @Test
    void shouldEvaluateComprehensionsAndSlices() {
        assertEquals("[1, 9, 25]", result("return [n * n for n in range(6) if n % 2 == 1]"));
        assertEquals("[2, 3]", result("return [1, 2, 3, 4][1:3]"));
        assertEquals("cba", result("""
                s = 'abc'
                out = ''
                for ch in s:
                    out = ch + out
                return out
                """));
        assertEquals("lo", result("return 'hello'[-2:]"));
    }

    @Test
    void shouldSupportStringAndCollectionMethods() {
        assertEquals("A-B-C", result("return '-'.join(['a', 'b', 'c']).upper()"));
        assertEquals("['x', 'y']", result("return ' x  y '.split()"));
        assertEquals("3", result("""
                counts = {}
                for word in ['a', 'b', 'a', 'a']:
                    counts[word] = counts.get(word, 0) + 1
                return counts['a']
                """));
        assertEquals("[['a', 1]]", result("return list({'a': 1}.items())"));
    }

    @Test
    void shouldChainComparisonsAndShortCircuit() {
        assertEquals("True", result("return 1 < 2 < 3"));
        assertEquals("False", result("return 1 < 3 < 2"));
        assertEquals("fallback", result("return None or 'fallback'"));
        assertEquals("yes", result("return 'yes' if 'b' in ['a', 'b'] else 'no'"));
    }

    @Test
    void shouldCatchPlanErrorsInTryExcept() {
        assertEquals("caught: division by zero", result("""
                try:
                    x = 1 / 0
                except ZeroDivisionError as e:
                    return 'caught: ' + e
                return 'not caught'
                """));
    }

    @Test
    void shouldSupportNestedFunctionsAndClosures() {
        assertEquals("15", PlanValues.str(solve("""
                def make_adder(n):
                    def add(x):
                        return x + n
                    return add

                def solve():
                    add10 = make_adder(10)
                    return add10(5)
                """)));
    }

    @Test
    void shouldUseJsonAndRegexModules() {
        assertEquals("42", result("return json.loads('{\"answer\": 42}')['answer']"));
        assertEquals("{\"a\":[1,2]}", result("return json.dumps({'a': [1, 2]})"));
        assertEquals("['12', '7']", result("return re.findall(r'\\d+', 'a12b7')"));
        assertEquals("2024", result("return re.search(r'(?P<year>\\d{4})', 'in 2024').group(1)"));
        assertEquals("b-a", result("return re.sub(r'(\\w)-(\\w)', r'\\2-\\1', 'a-b')"));
    }

    @Test
    void shouldJoinAwaitedFutures() {
        assertEquals(7L, PlanInterpreter.await(CompletableFuture.completedFuture(7)));
        assertEquals("plain", PlanInterpreter.await("plain"));
    }

    @Test
    void shouldRejectUnsupportedStatements() {
        assertThrows(PlanSyntaxException.class, () -> PlanParser.parse("def solve():\n    while True:\n        pass\n"));
        assertThrows(PlanSyntaxException.class, () -> PlanParser.parse("import subprocess\n"));
        assertThrows(PlanSyntaxException.class, () -> PlanParser.parse("from os import path\n"));
        assertThrows(PlanSyntaxException.class, () -> PlanParser.parse("def solve():\n    f = lambda x: x\n"));
    }

    @Test
    void shouldReportUndefinedNames() {
        var e = assertThrows(PlanExecutionException.class, () -> result("return missing_value"));
        assertEquals("name 'missing_value' is not defined", e.getMessage());
    }

    @Test
    void shouldStopRunawayLoops() {
        assertThrows(RuntimeException.class, () -> result("""
                total = 0
                for i in range(100000):
                    for j in range(100000):
                        total += 1
                return total
                """));
    }

    @Test
    void shouldExposeListsAsMutableValues() {
        Object value = solve("""
                def solve():
                    items = [3, 1, 2]
                    items.append(0)
                    return sorted(items, reverse=True)
                """);
        assertEquals(List.of(3L, 2L, 1L, 0L), value);
    }
}
