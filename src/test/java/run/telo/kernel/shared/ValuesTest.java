package run.telo.kernel.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class ValuesTest {
    @Test
    void followsJavaScriptTruthiness() {
        assertFalse(Values.isTruthy(null));
        assertFalse(Values.isTruthy(0));
        assertFalse(Values.isTruthy(Double.NaN));
        assertFalse(Values.isTruthy(""));
        assertTrue(Values.isTruthy("false"));
        assertTrue(Values.isTruthy(List.of()));
        assertTrue(Values.isTruthy(0.5));
    }

    @Test
    void stringifiesForInterpolation() {
        assertEquals("", Values.stringify(null));
        assertEquals("3", Values.stringify(3.0));
        assertEquals("2.5", Values.stringify(2.5));
        assertEquals("{\"a\":[1,2]}", Values.stringify(Map.of("a", List.of(1, 2))));
    }

    @Test
    void deepCopiesAreDetached() {
        var inner = new ArrayList<Object>(List.of(1));
        Map<String, Object> original = Map.of("list", inner);

        var copy = Values.copyMap(original);
        inner.add(2);

        assertEquals(List.of(1), copy.get("list"));
        assertNotSame(inner, copy.get("list"));
    }
}
