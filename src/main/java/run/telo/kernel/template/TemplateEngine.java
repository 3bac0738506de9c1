package run.telo.kernel.template;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import run.telo.kernel.config.KernelSettings;
import run.telo.kernel.expression.Evaluation;
import run.telo.kernel.expression.ExpressionException;
import run.telo.kernel.expression.Interpolator;
import run.telo.kernel.runtime.Resource;
import run.telo.kernel.runtime.ResourceUri;
import run.telo.kernel.shared.Values;

/**
 * Expands template instances into concrete resources.
 *
 * <p>Blueprints honour {@code if} (evaluated once, against the instance scope) and {@code for} (one clause or a
 * list of nested clauses, outer to inner). Loops are unrolled through an explicit worklist, so wide templates
 * never grow the call stack.
 */
public final class TemplateEngine {
    private static final Logger LOG = LoggerFactory.getLogger(TemplateEngine.class);

    static final String FOR = "for";
    static final String IF = "if";
    static final String RESOURCE = "resource";
    static final String VALUE = "value";

    private final Interpolator interpolator;
    private final KernelSettings settings;

    public TemplateEngine(Interpolator interpolator, KernelSettings settings) {
        this.interpolator = Objects.requireNonNull(interpolator, "interpolator");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public List<Resource> expandAll(List<Resource> resources) {
        return expandAll(resources, List.of());
    }

    /**
     * Replaces every template instance in {@code resources} with its expansion, in place, until none remain.
     * Template definitions stay in the output; instances do not.
     *
     * @param knownTemplates templates registered earlier that instances may refer to
     */
    public List<Resource> expandAll(List<Resource> resources, Collection<TemplateDefinition> knownTemplates) {
        var templates = new ArrayList<>(knownTemplates);
        for (var resource : resources) {
            if (TemplateDefinition.isTemplate(resource)) {
                templates.add(TemplateDefinition.from(resource));
            }
        }

        List<Resource> current = resources;
        for (int pass = 0; ; pass++) {
            var instances = current.stream().filter(r -> findTemplate(templates, r).isPresent()).toList();
            if (instances.isEmpty()) {
                return current;
            }
            if (pass == settings.maxExpansionPasses()) {
                var first = instances.get(0);
                throw new TemplateException(
                    TemplateException.Reason.TEMPLATE_EXPANSION_INCOMPLETE,
                    findTemplate(templates, first).map(TemplateDefinition::name).orElse(first.kind()),
                    first.generationDepth(),
                    "instances still unexpanded after " + pass + " passes: "
                        + instances.stream().map(r -> r.id().toString()).toList()
                );
            }
            var next = new ArrayList<Resource>();
            for (var resource : current) {
                var template = findTemplate(templates, resource);
                if (template.isEmpty()) {
                    next.add(resource);
                    continue;
                }
                var expanded = instantiate(
                    template.get(),
                    resource.fields(),
                    resource.name(),
                    resource.generationDepth(),
                    resource
                );
                for (var generated : expanded) {
                    if (TemplateDefinition.isTemplate(generated)) {
                        templates.add(TemplateDefinition.from(generated));
                    }
                }
                LOG.debug("Expanded {} into {} resource(s)", resource.id(), expanded.size());
                next.addAll(expanded);
            }
            current = next;
        }
    }

    public List<Resource> instantiate(TemplateDefinition template, Map<String, Object> parameters, String instanceName, int depth) {
        return instantiate(template, parameters, instanceName, depth, null);
    }

    /**
     * Expands one instance of {@code template}. Generated resources get {@code generationDepth = depth + 1}.
     *
     * @param instance the instantiating resource, used for lineage and inherited metadata; may be {@code null}
     */
    public List<Resource> instantiate(
        TemplateDefinition template,
        Map<String, Object> parameters,
        String instanceName,
        int depth,
        Resource instance
    ) {
        if (depth >= settings.maxExpansionDepth()) {
            throw new TemplateException(
                TemplateException.Reason.MAX_EXPANSION_DEPTH_EXCEEDED,
                template.name(),
                depth,
                "maximum expansion depth of " + settings.maxExpansionDepth() + " exceeded while expanding " + instanceName
            );
        }
        var scope = template.defaults();
        if (parameters != null) {
            parameters.forEach((key, value) -> scope.put(key, Values.deepCopy(value)));
        }
        expandParameters(template, instanceName, scope);
        for (var param : template.required()) {
            if (scope.get(param) == null) {
                throw new TemplateException(
                    TemplateException.Reason.MISSING_PARAMETER,
                    template.name(),
                    depth,
                    "instance " + instanceName + " is missing required parameter " + param
                );
            }
        }

        var expansion = new Expansion(template, depth, instance);
        var resources = new ArrayList<Resource>();
        var blueprints = template.blueprints();
        for (int i = 0; i < blueprints.size(); i++) {
            resources.addAll(expandBlueprint(expansion, i, blueprints.get(i), scope));
        }
        return resources;
    }

    /**
     * Parameters may reference each other. Ones that cannot be evaluated yet keep their text for the
     * registry-wide resolution pass, which fails if they stay unresolvable.
     */
    private void expandParameters(TemplateDefinition template, String instanceName, Map<String, Object> scope) {
        var snapshot = new LinkedHashMap<>(scope);
        for (var entry : scope.entrySet()) {
            try {
                entry.setValue(interpolator.expand(entry.getValue(), snapshot));
            } catch (ExpressionException ex) {
                LOG.debug(
                    "Parameter {} of {} instance {} left for registry resolution: {}",
                    entry.getKey(), template.name(), instanceName, ex.getMessage()
                );
            }
        }
    }

    private List<Resource> expandBlueprint(Expansion expansion, int index, Map<String, Object> blueprint, Map<String, Object> scope) {
        var results = new ArrayList<Resource>();
        for (var bindings : iterate(expansion, blueprint.get(IF), blueprint.get(FOR), scope)) {
            results.add(materialize(expansion, index, blueprint, bindings));
        }
        return results;
    }

    /**
     * Applies the {@code if} guard, then unrolls the {@code for} clauses into one scope per iteration.
     */
    private List<Map<String, Object>> iterate(Expansion expansion, Object guard, Object loops, Map<String, Object> scope) {
        if (guard != null && !Values.isTruthy(evaluateDirective(expansion, guard, scope))) {
            return List.of();
        }
        var directives = parseLoops(expansion, loops);
        var scopes = new ArrayList<Map<String, Object>>();
        var work = new ArrayDeque<Frame>();
        work.push(new Frame(scope, 0));
        while (!work.isEmpty()) {
            var frame = work.pop();
            if (frame.level() == directives.size()) {
                scopes.add(frame.scope());
                continue;
            }
            var directive = directives.get(frame.level());
            var target = evaluateDirective(expansion, directive.collection(), frame.scope());
            var bindings = directive.bindings(target);
            if (bindings == null) {
                throw new TemplateException(
                    TemplateException.Reason.INVALID_FOR_TARGET,
                    expansion.template().name(),
                    expansion.depth(),
                    "for \"" + directive.collection() + "\" evaluated to " + target.getClass().getSimpleName()
                        + ", expected an array or an object"
                );
            }
            for (int i = bindings.size() - 1; i >= 0; i--) {
                var extended = new LinkedHashMap<>(frame.scope());
                extended.putAll(bindings.get(i));
                work.push(new Frame(extended, frame.level() + 1));
            }
        }
        return scopes;
    }

    private List<ForDirective> parseLoops(Expansion expansion, Object loops) {
        if (loops == null) {
            return List.of();
        }
        var clauses = loops instanceof List<?> list ? list : List.of(loops);
        var directives = new ArrayList<ForDirective>();
        for (var clause : clauses) {
            var directive = clause instanceof String text ? ForDirective.parse(text) : Optional.<ForDirective>empty();
            if (directive.isEmpty()) {
                throw new TemplateException(
                    TemplateException.Reason.INVALID_FOR_EXPRESSION,
                    expansion.template().name(),
                    expansion.depth(),
                    "invalid for expression \"" + clause + "\", expected \"x in expr\" or \"k, v in expr\""
                );
            }
            directives.add(directive.get());
        }
        return directives;
    }

    private Object evaluateDirective(Expansion expansion, Object directive, Map<String, Object> scope) {
        if (!(directive instanceof String text)) {
            return directive;
        }
        var exact = Interpolator.EXACT.matcher(text);
        var expression = exact.matches() ? exact.group(1) : text;
        Evaluation outcome = interpolator.evaluate(expression, scope);
        if (outcome.isResolved()) {
            return outcome.value();
        }
        var reason = outcome.isDeferred() ? "it references a value only available at request time" : outcome.error().getMessage();
        throw new TemplateException(
            TemplateException.Reason.EXPRESSION_FAILED,
            expansion.template().name(),
            expansion.depth(),
            "cannot evaluate \"" + expression + "\": " + reason,
            outcome.error()
        );
    }

    private Resource materialize(Expansion expansion, int index, Map<String, Object> blueprint, Map<String, Object> scope) {
        var body = blueprint.get(RESOURCE) instanceof Map<?, ?> wrapped ? Values.asMap(wrapped) : blueprint;
        boolean nestedTemplate = TemplateDefinition.KIND.equals(body.get(Resource.KIND));
        var expanded = new LinkedHashMap<String, Object>();
        try {
            for (var entry : body.entrySet()) {
                var key = entry.getKey();
                if (FOR.equals(key) || IF.equals(key)) {
                    continue;
                }
                if (nestedTemplate && (TemplateDefinition.RESOURCES.equals(key) || TemplateDefinition.SCHEMA.equals(key))) {
                    expanded.put(key, Values.deepCopy(entry.getValue()));
                } else {
                    expanded.put(key, expandValue(expansion, entry.getValue(), scope));
                }
            }
        } catch (ExpressionException ex) {
            throw new TemplateException(
                TemplateException.Reason.EXPRESSION_FAILED,
                expansion.template().name(),
                expansion.depth(),
                "blueprint #" + index + ": " + ex.getMessage(),
                ex
            );
        }
        return finish(expansion, index, expanded);
    }

    private Object expandValue(Expansion expansion, Object value, Map<String, Object> scope) {
        if (value instanceof String text) {
            return interpolator.interpolate(text, scope);
        }
        if (value instanceof Map<?, ?> map) {
            var expanded = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> expanded.put(String.valueOf(k), expandValue(expansion, v, scope)));
            return expanded;
        }
        if (value instanceof List<?> list) {
            var expanded = new ArrayList<Object>();
            for (var item : list) {
                if (item instanceof Map<?, ?> map && (map.containsKey(FOR) || map.containsKey(IF))) {
                    expanded.addAll(expandItem(expansion, Values.asMap(map), scope));
                } else {
                    expanded.add(expandValue(expansion, item, scope));
                }
            }
            return expanded;
        }
        return value;
    }

    /**
     * Array element carrying its own {@code for}/{@code if}: emits its {@code value} (or its remaining fields)
     * once per iteration.
     */
    private List<Object> expandItem(Expansion expansion, Map<String, Object> item, Map<String, Object> scope) {
        Object payload;
        if (item.containsKey(VALUE)) {
            payload = item.get(VALUE);
        } else {
            var rest = new LinkedHashMap<>(item);
            rest.remove(FOR);
            rest.remove(IF);
            payload = rest;
        }
        var items = new ArrayList<Object>();
        for (var bindings : iterate(expansion, item.get(IF), item.get(FOR), scope)) {
            items.add(expandValue(expansion, payload, bindings));
        }
        return items;
    }

    private Resource finish(Expansion expansion, int index, Map<String, Object> expanded) {
        var kind = expanded.get(Resource.KIND);
        if (!(kind instanceof String k) || k.isBlank()) {
            throw invalidBlueprint(expansion, index, "expanded resource has no kind");
        }
        var metadata = new LinkedHashMap<>(Values.asMap(expanded.get(Resource.METADATA)));
        var name = metadata.get(Resource.NAME);
        if (name instanceof Number || name instanceof Boolean) {
            name = String.valueOf(name);
        }
        if (!(name instanceof String n) || n.isBlank()) {
            throw invalidBlueprint(expansion, index, "expanded " + kind + " resource has no metadata.name");
        }
        metadata.put(Resource.NAME, name);

        var instance = expansion.instance();
        var lineage = instance != null && instance.uri() != null
            ? instance.uri()
            : ResourceUri.forTemplate(expansion.template().name());
        var module = instance != null && instance.module() != null ? instance.module() : expansion.template().module();
        if (module != null) {
            metadata.putIfAbsent(Resource.MODULE, module);
        }
        if (instance != null && instance.source() != null) {
            metadata.putIfAbsent(Resource.SOURCE, instance.source());
        }
        metadata.put(Resource.URI, ResourceUri.child(lineage, (String) kind, (String) name));
        metadata.put(Resource.GENERATION_DEPTH, expansion.depth() + 1);
        expanded.put(Resource.METADATA, metadata);
        return Resource.of(expanded);
    }

    private static TemplateException invalidBlueprint(Expansion expansion, int index, String message) {
        return new TemplateException(
            TemplateException.Reason.INVALID_BLUEPRINT,
            expansion.template().name(),
            expansion.depth(),
            "blueprint #" + index + ": " + message
        );
    }

    private static Optional<TemplateDefinition> findTemplate(List<TemplateDefinition> templates, Resource resource) {
        if (TemplateDefinition.isTemplate(resource)) {
            return Optional.empty();
        }
        for (int i = templates.size() - 1; i >= 0; i--) {
            if (templates.get(i).instantiatedBy(resource.kind())) {
                return Optional.of(templates.get(i));
            }
        }
        return Optional.empty();
    }

    private record Expansion(TemplateDefinition template, int depth, Resource instance) {}

    private record Frame(Map<String, Object> scope, int level) {}
}
