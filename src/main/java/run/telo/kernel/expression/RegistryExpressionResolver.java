package run.telo.kernel.expression;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import run.telo.kernel.config.KernelSettings;
import run.telo.kernel.runtime.ErrorCode;
import run.telo.kernel.runtime.KernelException;
import run.telo.kernel.runtime.Resource;
import run.telo.kernel.runtime.ResourceId;
import run.telo.kernel.runtime.ResourceRegistry;
import run.telo.kernel.template.TemplateDefinition;
import run.telo.kernel.shared.Values;

/**
 * Fixed-point resolution of {@code ${{ }}} expressions across every registered resource.
 *
 * <p>Each pass evaluates against one scope holding the allow-listed environment ({@code env}), every resource
 * nested by kind segments then name ({@code Http.Server.main}), and a flat {@code Resources["Kind.Name"]} map.
 */
public final class RegistryExpressionResolver {
    private static final Logger LOG = LoggerFactory.getLogger(RegistryExpressionResolver.class);

    private final Interpolator interpolator;
    private final KernelSettings settings;
    private final Map<String, String> environment;

    public RegistryExpressionResolver(Interpolator interpolator, KernelSettings settings) {
        this(interpolator, settings, System.getenv());
    }

    public RegistryExpressionResolver(Interpolator interpolator, KernelSettings settings, Map<String, String> environment) {
        this.interpolator = Objects.requireNonNull(interpolator, "interpolator");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.environment = Map.copyOf(environment);
    }

    public int resolve(ResourceRegistry registry) {
        return resolve(registry, registry.all().stream().map(Resource::id).toList());
    }

    /**
     * Resolves {@code targets} in place, returning the number of passes it took.
     */
    public int resolve(ResourceRegistry registry, Collection<ResourceId> targets) {
        int limit = settings.maxResolutionPasses();
        for (int pass = 1; pass <= limit; pass++) {
            var scope = buildScope(registry);
            boolean changed = false;
            for (var id : targets) {
                var current = registry.get(id).orElse(null);
                if (current == null) {
                    continue;
                }
                var updated = resolveResource(current, scope);
                if (!updated.equals(current)) {
                    registry.replace(updated);
                    changed = true;
                }
            }
            if (!changed) {
                LOG.debug("Expression resolution settled after {} pass(es)", pass);
                return pass;
            }
        }
        var remaining = unresolved(registry, targets, buildScope(registry));
        if (!remaining.isEmpty()) {
            throw new KernelException(
                ErrorCode.ERR_EXPRESSION_FAILED,
                "Expression resolution did not settle within " + limit
                    + " passes (raise maxResolutionPasses if the chain of references is deeper). Still unresolved:\n"
                    + String.join("\n", remaining)
            );
        }
        return limit;
    }

    public Map<String, Object> buildScope(ResourceRegistry registry) {
        var scope = new LinkedHashMap<String, Object>();
        var env = new LinkedHashMap<String, Object>();
        for (var name : settings.allowedEnvironment()) {
            var value = environment.get(name);
            if (value != null) {
                env.put(name, value);
            }
        }
        scope.put("env", env);

        var flat = new LinkedHashMap<String, Object>();
        for (var resource : registry.all()) {
            var document = resource.toMap();
            Map<String, Object> cursor = scope;
            for (var segment : resource.kind().split("\\.")) {
                var existing = cursor.get(segment);
                if (existing instanceof Map<?, ?>) {
                    cursor = Values.asMap(existing);
                } else {
                    var nested = new LinkedHashMap<String, Object>();
                    cursor.put(segment, nested);
                    cursor = nested;
                }
            }
            cursor.put(resource.name(), document);
            flat.put(resource.id().toString(), document);
        }
        scope.put("Resources", flat);
        return scope;
    }

    Resource resolveResource(Resource resource, Map<String, Object> scope) {
        var document = resource.toMap();
        boolean template = TemplateDefinition.KIND.equals(resource.kind());
        try {
            for (var entry : document.entrySet()) {
                var key = entry.getKey();
                if (Resource.KIND.equals(key) || (template && isTemplateBody(key))) {
                    continue;
                }
                if (Resource.METADATA.equals(key)) {
                    entry.setValue(resolveMetadata(Values.asMap(entry.getValue()), scope));
                } else {
                    entry.setValue(interpolator.expand(entry.getValue(), scope));
                }
            }
        } catch (ExpressionException ex) {
            throw new KernelException(
                ErrorCode.ERR_EXPRESSION_FAILED,
                resource.id(),
                "Failed to resolve expressions of " + resource.id() + ": " + ex.getMessage(),
                ex
            );
        }
        return Resource.of(document);
    }

    private Map<String, Object> resolveMetadata(Map<String, Object> metadata, Map<String, Object> scope) {
        var resolved = new LinkedHashMap<String, Object>();
        metadata.forEach((key, value) ->
            resolved.put(key, Resource.NAME.equals(key) ? value : interpolator.expand(value, scope)));
        return resolved;
    }

    private List<String> unresolved(ResourceRegistry registry, Collection<ResourceId> targets, Map<String, Object> scope) {
        var remaining = new ArrayList<String>();
        for (var id : targets) {
            var resource = registry.get(id).orElse(null);
            if (resource == null) {
                continue;
            }
            boolean template = TemplateDefinition.KIND.equals(resource.kind());
            resource.fields().forEach((key, value) -> {
                if (template && isTemplateBody(key)) {
                    return;
                }
                for (var expression : Interpolator.expressionsIn(value)) {
                    if (!interpolator.isDeferred(expression, scope)) {
                        remaining.add("- " + id + ": ${{ " + expression + " }}");
                    }
                }
            });
        }
        return remaining;
    }

    private static boolean isTemplateBody(String key) {
        return TemplateDefinition.RESOURCES.equals(key) || TemplateDefinition.SCHEMA.equals(key);
    }
}
