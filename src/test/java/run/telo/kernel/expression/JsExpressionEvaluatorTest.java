package run.telo.kernel.expression;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import run.telo.kernel.runtime.ErrorCode;

final class JsExpressionEvaluatorTest {
    private final JsExpressionEvaluator evaluator = new JsExpressionEvaluator();

    @AfterEach
    void close() {
        evaluator.close();
    }

    @Test
    void evaluatesAgainstTheScope() {
        Map<String, Object> scope = Map.of("port", 8080, "server", Map.of("host", "localhost"));

        assertEquals(8081, evaluator.evaluate("port + 1", scope));
        assertEquals("localhost:8080", evaluator.evaluate("`${server.host}:${port}`", scope));
        assertEquals(true, evaluator.evaluate("port > 1024 && server.host === 'localhost'", scope));
    }

    @Test
    void convertsResultsToPlainJavaValues() {
        assertEquals(List.of(2, 4), evaluator.evaluate("xs.map(x => x * 2)", Map.of("xs", List.of(1, 2))));
        assertEquals(Map.of("a", 1), evaluator.evaluate("({ a: 1 })", Map.of()));
        assertEquals(1.5, evaluator.evaluate("3 / 2", Map.of()));
        assertEquals(5_000_000_000L, evaluator.evaluate("5000000000", Map.of()));
        assertNull(evaluator.evaluate("null", Map.of()));
    }

    @Test
    void interpolatesObjectLiteralsAndTemplateStrings() {
        var interpolator = new Interpolator(evaluator, List.of());

        assertEquals(1, interpolator.interpolate("${{ ({ a: 1 }).a }}", Map.of()));
        assertEquals("port 8080", interpolator.interpolate("${{ `port ${port}` }}", Map.of("port", 8080)));
    }

    @Test
    void unknownIdentifiersFail() {
        var error = assertThrows(ExpressionException.class, () -> evaluator.evaluate("missing.field", Map.of()));

        assertEquals(ErrorCode.ERR_EXPRESSION_FAILED, error.code());
        assertEquals("missing.field", error.expression());
    }

    @Test
    void syntaxErrorsAndBlankExpressionsFail() {
        assertThrows(ExpressionException.class, () -> evaluator.evaluate("1 +", Map.of()));
        assertThrows(ExpressionException.class, () -> evaluator.evaluate("  ", Map.of()));
    }

    @Test
    void closingTwiceIsHarmless() {
        evaluator.close();
        evaluator.close();
    }
}
