package run.telo.kernel.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static run.telo.kernel.support.KernelTestSupport.manifest;
import static run.telo.kernel.support.KernelTestSupport.resource;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import run.telo.kernel.config.KernelSettings;
import run.telo.kernel.expression.Interpolator;
import run.telo.kernel.expression.JsExpressionEvaluator;
import run.telo.kernel.runtime.Resource;
import run.telo.kernel.shared.Values;

final class TemplateEngineTest {
    private final JsExpressionEvaluator evaluator = new JsExpressionEvaluator();
    private final KernelSettings settings = KernelSettings.defaults();
    private final TemplateEngine engine = new TemplateEngine(new Interpolator(evaluator, settings.deferredRoots()), settings);

    @AfterEach
    void closeEvaluator() {
        evaluator.close();
    }

    @Test
    void expandsOneResourcePerLoopItem() {
        var template = template(
            "RegionalService",
            Map.of(
                "regions", Map.of("type", "array", "default", List.of("a", "b")),
                "prefix", Map.of("type", "string", "default", "X")
            ),
            manifest("Service", "${{ prefix }}-${{ r }}", "for", "r in regions", "region", "${{ r }}")
        );

        var resources = engine.instantiate(template, Map.of(), "eu", 0);

        assertEquals(List.of("X-a", "X-b"), resources.stream().map(Resource::name).toList());
        assertEquals("b", resources.get(1).get("region"));
        assertTrue(resources.stream().noneMatch(r -> r.fields().containsKey("for")));
        assertEquals(1, resources.get(0).generationDepth());
        assertEquals("template://RegionalService/Service.X-a", resources.get(0).uri());
    }

    @Test
    void regionTemplateWithoutOverridesYieldsOneResourcePerDefaultRegion() {
        var template = template(
            "Region",
            Map.of("regions", Map.of("type", "array", "default", List.of("a", "b"))),
            manifest("X", "${{ r }}", "for", "r in regions")
        );

        var resources = engine.instantiate(template, Map.of(), "region", 0);

        assertEquals(List.of("X.a", "X.b"), resources.stream().map(r -> r.id().toString()).toList());
    }

    @Test
    void exactInterpolationsKeepTheirTypeAndMixedTextBecomesAString() {
        var template = template(
            "Server",
            Map.of("port", Map.of("type", "integer", "required", true)),
            manifest("Http.Listener", "main", "port", "${{ port }}", "banner", "listening on ${{ port }}")
        );

        var listener = engine.instantiate(template, Map.of("port", 8080), "api", 0).get(0);

        assertEquals(8080, listener.get("port"));
        assertEquals("listening on 8080", listener.get("banner"));
    }

    @Test
    void nestedLoopsProduceTheCartesianProductOuterFirst() {
        var template = template(
            "Grid",
            Map.of(
                "rows", Map.of("default", List.of("r1", "r2")),
                "cols", Map.of("default", List.of("c1", "c2", "c3"))
            ),
            manifest("Cell", "${{ row }}-${{ col }}", "for", List.of("row in rows", "col in cols"))
        );

        var names = engine.instantiate(template, Map.of(), "grid", 0).stream().map(Resource::name).toList();

        assertEquals(List.of("r1-c1", "r1-c2", "r1-c3", "r2-c1", "r2-c2", "r2-c3"), names);
    }

    @Test
    void keyValueLoopsWalkMapsInOrder() {
        var template = template(
            "Routes",
            Map.of("routes", Map.of("default", Map.of("home", "/"))),
            manifest("Route", "${{ key }}", "for", "key, path in routes", "path", "${{ path }}")
        );

        var route = engine.instantiate(template, Map.of(), "web", 0).get(0);

        assertEquals("home", route.name());
        assertEquals("/", route.get("path"));
    }

    @Test
    void falsyGuardsSkipTheBlueprint() {
        var template = template(
            "Optional",
            Map.of("enabled", Map.of("type", "boolean", "default", false)),
            manifest("Cache", "local", "if", "${{ enabled }}"),
            manifest("Store", "main")
        );

        assertEquals(List.of("Store"), engine.instantiate(template, Map.of(), "opt", 0).stream().map(Resource::kind).toList());
        assertEquals(2, engine.instantiate(template, Map.of("enabled", true), "opt", 0).size());
    }

    @Test
    void arrayItemsCanLoopOnTheirOwn() {
        var template = template(
            "Pool",
            Map.of("hosts", Map.of("default", List.of("h1", "h2"))),
            manifest("Balancer", "lb", "targets", List.of("primary", Map.of("for", "h in hosts", "value", "${{ h }}:80")))
        );

        var balancer = engine.instantiate(template, Map.of(), "pool", 0).get(0);

        assertEquals(List.of("primary", "h1:80", "h2:80"), balancer.get("targets"));
    }

    @Test
    void enforcesTheMaximumExpansionDepth() {
        var template = template("Leaf", Map.of(), manifest("Node", "n"));

        assertEquals(10, engine.instantiate(template, Map.of(), "deep", 9).get(0).generationDepth());
        var error = assertThrows(TemplateException.class, () -> engine.instantiate(template, Map.of(), "deeper", 10));
        assertEquals(TemplateException.Reason.MAX_EXPANSION_DEPTH_EXCEEDED, error.reason());
        assertEquals("Leaf", error.template());
        assertEquals(10, error.depth());
    }

    @Test
    void rejectsMalformedLoops() {
        var badSyntax = template("A", Map.of("items", Map.of("default", List.of(1))), manifest("X", "x", "for", "items"));
        var notIterable = template("B", Map.of("count", Map.of("default", 3)), manifest("X", "x", "for", "i in count"));

        assertEquals(
            TemplateException.Reason.INVALID_FOR_EXPRESSION,
            assertThrows(TemplateException.class, () -> engine.instantiate(badSyntax, Map.of(), "a", 0)).reason()
        );
        assertEquals(
            TemplateException.Reason.INVALID_FOR_TARGET,
            assertThrows(TemplateException.class, () -> engine.instantiate(notIterable, Map.of(), "b", 0)).reason()
        );
    }

    @Test
    void blueprintsMustExpandToIdentifiedResources() {
        var template = template("Nameless", Map.of(), Map.of("kind", "Thing", "metadata", Map.of()));

        var error = assertThrows(TemplateException.class, () -> engine.instantiate(template, Map.of(), "n", 0));

        assertEquals(TemplateException.Reason.INVALID_BLUEPRINT, error.reason());
        assertTrue(error.getMessage().contains("no metadata.name"), error.getMessage());
    }

    @Test
    void requiredParametersMustBeSupplied() {
        var template = TemplateDefinition.from(resource(
            TemplateDefinition.KIND,
            "Db",
            "schema", Map.of("type", "object", "properties", Map.of("url", Map.of("type", "string")), "required", List.of("url")),
            "resources", List.of(manifest("Pool", "p", "url", "${{ url }}"))
        ));

        var error = assertThrows(TemplateException.class, () -> engine.instantiate(template, Map.of(), "db", 0));

        assertEquals(TemplateException.Reason.MISSING_PARAMETER, error.reason());
        assertTrue(error.getMessage().contains("missing required parameter url"), error.getMessage());
    }

    @Test
    void requestScopedExpressionsStayLiteral() {
        var template = template("Handler", Map.of(), manifest("Route", "r", "reply", "${{ request.body }}"));

        assertEquals("${{ request.body }}", engine.instantiate(template, Map.of(), "h", 0).get(0).get("reply"));
    }

    @Test
    void expandAllReplacesInstancesAndKeepsDefinitions() {
        var inner = manifest(
            TemplateDefinition.KIND, "Inner",
            "schema", Map.of("label", Map.of("default", "in")),
            "resources", List.of(manifest("Leaf", "${{ label }}"))
        );
        var outer = resource(
            TemplateDefinition.KIND, "Outer",
            "schema", Map.of(),
            "resources", List.of(inner, manifest("Inner", "nested"))
        );

        var expanded = engine.expandAll(List.of(outer, resource("Outer", "top"), resource("Plain", "p")));

        var ids = expanded.stream().map(r -> r.id().toString()).toList();
        assertEquals(List.of("TemplateDefinition.Outer", "TemplateDefinition.Inner", "Leaf.in", "Plain.p"), ids);
        var leaf = expanded.get(2);
        assertEquals(2, leaf.generationDepth());
        assertEquals("template://Outer/Inner.nested/Leaf.in", leaf.uri());
    }

    @Test
    void unexpandableInstancesFailAfterThePassLimit() {
        var limited = new TemplateEngine(
            new Interpolator(evaluator, settings.deferredRoots()),
            settings.toBuilder().maxExpansionPasses(2).build()
        );
        var looping = resource(
            TemplateDefinition.KIND, "Loop",
            "schema", Map.of(),
            "resources", List.of(manifest("Loop", "again"))
        );

        var error = assertThrows(TemplateException.class, () -> limited.expandAll(List.of(looping, resource("Loop", "start"))));

        assertEquals(TemplateException.Reason.TEMPLATE_EXPANSION_INCOMPLETE, error.reason());
    }

    private static TemplateDefinition template(String name, Map<String, Object> parameters, Map<?, ?>... blueprints) {
        return TemplateDefinition.from(resource(
            TemplateDefinition.KIND,
            name,
            "schema", Values.copyMap(parameters),
            "resources", List.of((Object[]) blueprints)
        ));
    }
}
