package run.telo.kernel.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class ForDirectiveTest {
    @Test
    void parsesSingleAndPairedVariables() {
        assertEquals(new ForDirective("item", null, "items"), ForDirective.parse("item in items").orElseThrow());
        assertEquals(
            new ForDirective("key", "value", "config.entries"),
            ForDirective.parse("  key ,value in config.entries ").orElseThrow()
        );
    }

    @Test
    void rejectsTextOutsideTheLoopGrammar() {
        assertTrue(ForDirective.parse("items").isEmpty());
        assertTrue(ForDirective.parse("in items").isEmpty());
        assertTrue(ForDirective.parse("a, b, c in items").isEmpty());
        assertTrue(ForDirective.parse(null).isEmpty());
    }

    @Test
    void bindsIndexAndElementForArrays() {
        var directive = ForDirective.parse("i, name in names").orElseThrow();

        assertEquals(
            List.of(Map.of("i", 0, "name", "ada"), Map.of("i", 1, "name", "linus")),
            directive.bindings(List.of("ada", "linus"))
        );
    }

    @Test
    void bindsKeysForObjects() {
        var ports = new LinkedHashMap<String, Object>();
        ports.put("http", 80);
        ports.put("https", 443);

        assertEquals(List.of(Map.of("p", "http"), Map.of("p", "https")), ForDirective.parse("p in ports").orElseThrow().bindings(ports));
        assertEquals(
            List.of(Map.of("p", "http", "n", 80), Map.of("p", "https", "n", 443)),
            ForDirective.parse("p, n in ports").orElseThrow().bindings(ports)
        );
    }

    @Test
    void nullIteratesNothingAndScalarsAreNotIterable() {
        var directive = ForDirective.parse("x in xs").orElseThrow();

        assertTrue(directive.bindings(null).isEmpty());
        assertNull(directive.bindings("text"));
    }
}
