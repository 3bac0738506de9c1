package run.telo.kernel.runtime;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import run.telo.kernel.config.KernelSettings;
import run.telo.kernel.expression.ExpressionEvaluator;
import run.telo.kernel.expression.Interpolator;
import run.telo.kernel.expression.RegistryExpressionResolver;
import run.telo.kernel.template.TemplateDefinition;
import run.telo.kernel.template.TemplateEngine;

/**
 * Boots a set of resources and drives each one through create, init, run and teardown.
 *
 * <p>Boot runs load, resolve (dependency ordering, template expansion, registry-wide expression resolution),
 * register and multi-pass controller discovery. Any failure up to the end of discovery tears down what was
 * already created and propagates. {@link #start()} then runs every instance in creation order, waits until no
 * hold is outstanding and tears everything down in reverse creation order, children before their parent.
 *
 * <p>The kernel is driven by one control flow. Holds may be released from other threads.
 */
public final class Kernel implements AutoCloseable {
    public static final String STARTING = "Runtime.Starting";
    public static final String STARTED = "Runtime.Started";
    public static final String STOPPING = "Runtime.Stopping";
    public static final String STOPPED = "Runtime.Stopped";
    public static final String INITIALIZED = "Initialized";
    public static final String TEARDOWN = "Teardown";
    public static final String INVOKED = "Invoked";

    private static final Logger LOG = LoggerFactory.getLogger(Kernel.class);
    private static final Set<String> RESERVED_EVENTS = Set.of(INITIALIZED, TEARDOWN);

    private final KernelSettings settings;
    private final ExpressionEvaluator evaluator;
    private final Interpolator interpolator;
    private final TemplateEngine templates;
    private final RegistryExpressionResolver resolver;
    private final ManifestLoader manifestLoader;
    private final ControllerRegistry controllers;
    private final ResourceRegistry registry = new ResourceRegistry();
    private final EventBus events = new EventBus();
    private final HoldTracker holds;
    private final List<Resource> loaded = new ArrayList<>();
    private final List<ResourceId> unhandled = new ArrayList<>();
    private final Map<ResourceId, LiveResource> instances = new LinkedHashMap<>();
    private final Map<ResourceId, List<ResourceId>> children = new LinkedHashMap<>();
    private final Set<String> registeredKinds = new HashSet<>();
    private final AtomicInteger exitCode = new AtomicInteger();
    private final CompletableFuture<Integer> termination = new CompletableFuture<>();
    private volatile KernelState state = KernelState.CREATED;
    private volatile EventStream eventStream;
    private boolean discovering;

    public Kernel(KernelSettings settings, ExpressionEvaluator evaluator) {
        this(settings, evaluator, new ControllerRegistry(), System.getenv());
    }

    public Kernel(
        KernelSettings settings,
        ExpressionEvaluator evaluator,
        ControllerRegistry controllers,
        Map<String, String> environment
    ) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.controllers = Objects.requireNonNull(controllers, "controllers");
        this.interpolator = new Interpolator(evaluator, settings.deferredRoots());
        this.templates = new TemplateEngine(interpolator, settings);
        this.resolver = new RegistryExpressionResolver(interpolator, settings, environment);
        this.manifestLoader = new ManifestLoader(settings.allowedEnvironment(), environment);
        this.holds = new HoldTracker(this::publishQuietly);
    }

    // ----- loading -----------------------------------------------------------------------------------------

    public void loadFromConfig(String location) {
        requireState("load", KernelState.CREATED, KernelState.LOADED);
        var resources = manifestLoader.load(location);
        loaded.addAll(resources);
        state = KernelState.LOADED;
        LOG.info("Loaded {} resource(s) from {}", resources.size(), location);
    }

    public void loadResources(List<? extends Map<String, ?>> documents) {
        requireState("load", KernelState.CREATED, KernelState.LOADED);
        for (var document : documents) {
            var resource = Resource.of(document);
            loaded.add(resource.metadata().get(Resource.GENERATION_DEPTH) == null
                ? resource.withMetadata(Resource.GENERATION_DEPTH, 0)
                : resource);
        }
        state = KernelState.LOADED;
    }

    // ----- boot ----------------------------------------------------------------------------------------------

    /**
     * Resolves, registers and discovers every loaded resource.
     */
    public void boot() {
        requireState("boot", KernelState.CREATED, KernelState.LOADED);
        try {
            LOG.info("Booting kernel with {} resource(s)", loaded.size());
            var resolved = DependencyOrderer.order(templates.expandAll(DependencyOrderer.order(loaded)));
            state = KernelState.RESOLVED;
            for (var resource : resolved) {
                registry.register(resource);
            }
            int passes = resolver.resolve(registry);
            LOG.debug("Registered {} resource(s); expressions settled in {} pass(es)", registry.size(), passes);
            state = KernelState.REGISTERED;
            registry.all().forEach(resource -> unhandled.add(resource.id()));
            discover();
            state = KernelState.DISCOVERED;
            LOG.info("Discovery complete: {} live instance(s)", instances.size());
        } catch (RuntimeException ex) {
            state = KernelState.FAILED;
            try {
                teardownResources();
            } catch (RuntimeException teardownFailure) {
                ex.addSuppressed(teardownFailure);
            }
            termination.complete(exitCode.get());
            throw ex;
        }
    }

    /**
     * Boots if needed, runs every instance, waits for idle, then tears down.
     *
     * @return the highest exit code requested through {@link #requestExit(int)}
     */
    public int start() {
        if (state == KernelState.CREATED || state == KernelState.LOADED) {
            boot();
        }
        requireState("start", KernelState.DISCOVERED);
        RuntimeException primary = null;
        try {
            publish(STARTING, Map.of());
            state = KernelState.RUNNING;
            runInstances(new ArrayList<>(instances.values()));
            publish(STARTED, Map.of());
            state = KernelState.IDLE;
            LOG.info("Kernel started; {} hold(s) outstanding", holds.count());
            holds.waitForIdle().join();
        } catch (RuntimeException ex) {
            primary = ex;
            requestExit(1);
            throw ex;
        } finally {
            var stopFailure = stop();
            if (stopFailure != null) {
                if (primary != null) {
                    primary.addSuppressed(stopFailure);
                } else {
                    throw stopFailure;
                }
            }
        }
        return exitCode.get();
    }

    private RuntimeException stop() {
        state = KernelState.STOPPING;
        LOG.info("Stopping kernel");
        RuntimeException failure = null;
        try {
            publish(STOPPING, Map.of());
        } catch (RuntimeException ex) {
            failure = ex;
        }
        try {
            teardownResources();
        } catch (RuntimeException ex) {
            failure = merge(failure, ex);
        }
        try {
            publish(STOPPED, Map.of("exitCode", exitCode.get()));
        } catch (RuntimeException ex) {
            failure = merge(failure, ex);
        }
        state = KernelState.STOPPED;
        termination.complete(exitCode.get());
        return failure;
    }

    private void discover() {
        discovering = true;
        try {
            var errors = new LinkedHashMap<ResourceId, Exception>();
            int limit = settings.maxDiscoveryPasses();
            for (int pass = 1; pass <= limit && !unhandled.isEmpty(); pass++) {
                int handled = 0;
                for (var id : new ArrayList<>(unhandled)) {
                    var resource = registry.get(id).orElse(null);
                    if (resource == null) {
                        unhandled.remove(id);
                        continue;
                    }
                    Optional<Controller> controller;
                    try {
                        controller = controllers.find(id.kind());
                    } catch (KernelException ex) {
                        errors.put(id, ex);
                        continue;
                    }
                    if (controller.isEmpty()) {
                        errors.put(id, new KernelException(
                            ErrorCode.ERR_CONTROLLER_NOT_FOUND,
                            id,
                            "No controller registered for kind " + id.kind(),
                            null
                        ));
                        continue;
                    }
                    if (controller.get().factory().isEmpty()) {
                        throw new KernelException(
                            ErrorCode.ERR_CONTROLLER_INVALID,
                            id,
                            "Controller for kind " + id.kind() + " cannot create " + id + ": it has no create capability",
                            null
                        );
                    }
                    LiveResource live;
                    try {
                        live = instantiate(resource, controller.get());
                    } catch (Exception ex) {
                        LOG.debug("Pass {}: {} not created yet: {}", pass, id, KernelException.describe(ex));
                        errors.put(id, ex);
                        continue;
                    }
                    unhandled.remove(id);
                    errors.remove(id);
                    handled++;
                    if (live != null) {
                        publish(id.kind() + "." + INITIALIZED, describe(id));
                    }
                }
                LOG.debug("Discovery pass {} handled {} resource(s), {} left", pass, handled, unhandled.size());
                if (handled == 0) {
                    break;
                }
            }
            if (!unhandled.isEmpty()) {
                throw discoveryFailure(errors);
            }
        } finally {
            discovering = false;
        }
    }

    private LiveResource instantiate(Resource resource, Controller controller) throws Exception {
        var id = resource.id();
        var context = new KernelResourceContext(id);
        ensureRegistered(id.kind(), controller);
        var target = resource;
        if (controller.compiler().isPresent()) {
            var compiled = controller.compiler().get().compile(resource, context);
            if (compiled != null) {
                if (!compiled.id().equals(id)) {
                    throw new KernelException(
                        ErrorCode.ERR_CONTROLLER_INVALID,
                        id,
                        "Compiling " + id + " must not change its identity (got " + compiled.id() + ")",
                        null
                    );
                }
                registry.replace(compiled);
                target = compiled;
            }
        }
        if (!controller.hasSchema()) {
            throw new KernelException(
                ErrorCode.ERR_CONTROLLER_INVALID,
                id,
                "No schema defined for the controller of kind " + id.kind(),
                null
            );
        }
        SchemaValidator.validate(id, target.toMap(), controller.schema());
        var instance = controller.factory().orElseThrow().create(target, context);
        if (instance == null) {
            LOG.debug("{} consumed by its controller", id);
            return null;
        }
        try {
            instance.init(context);
        } catch (Exception ex) {
            try {
                instance.teardown();
            } catch (Exception teardownFailure) {
                ex.addSuppressed(teardownFailure);
            }
            throw ex;
        }
        var live = new LiveResource(target, instance);
        instances.put(id, live);
        LOG.debug("Initialized {}", id);
        return live;
    }

    private void ensureRegistered(String kind, Controller controller) throws Exception {
        if (controller.registrar().isEmpty() || !registeredKinds.add(kind)) {
            return;
        }
        try {
            controller.registrar().get().register(new KernelControllerContext(kind));
        } catch (Exception ex) {
            registeredKinds.remove(kind);
            throw ex;
        }
    }

    private KernelException discoveryFailure(Map<ResourceId, Exception> errors) {
        var lines = new ArrayList<String>();
        var causes = new ArrayList<Exception>();
        for (var id : unhandled) {
            var error = errors.get(id);
            if (error == null) {
                lines.add("- " + id + ": not processed within " + settings.maxDiscoveryPasses() + " discovery passes");
            } else {
                lines.add("- " + id + ": " + KernelException.describe(error));
                causes.add(error);
            }
        }
        var failure = new KernelException(
            ErrorCode.ERR_CONTROLLER_NOT_FOUND,
            "Unable to process resources:\n" + String.join("\n", lines),
            causes.isEmpty() ? null : causes.get(0)
        );
        causes.stream().skip(1).forEach(failure::addSuppressed);
        return failure;
    }

    private void runInstances(List<LiveResource> targets) {
        for (var live : targets) {
            var id = live.resource().id();
            if (!instances.containsKey(id)) {
                continue;
            }
            try {
                live.instance().run();
            } catch (Exception ex) {
                throw new KernelException(
                    ErrorCode.ERR_EXECUTION_FAILED,
                    id,
                    "Run of " + id + " failed: " + KernelException.describe(ex),
                    ex
                );
            }
        }
    }

    /**
     * Admits resources registered after boot started: expands, registers, resolves and queues them. Past
     * discovery, they are discovered right away and, once running, run as well.
     */
    private void admit(List<Resource> incoming, ResourceId parent) {
        var knownTemplates = registry.getByKind(TemplateDefinition.KIND).stream().map(TemplateDefinition::from).toList();
        var resolved = DependencyOrderer.order(templates.expandAll(DependencyOrderer.order(incoming), knownTemplates));
        var ids = new ArrayList<ResourceId>();
        for (var resource : resolved) {
            registry.register(resource);
            ids.add(resource.id());
        }
        resolver.resolve(registry, ids);
        unhandled.addAll(ids);
        if (parent != null) {
            children.computeIfAbsent(parent, k -> new ArrayList<>()).addAll(ids);
        }
        LOG.debug("Admitted {} resource(s){}", ids.size(), parent == null ? "" : " as children of " + parent);
        if (discovering || !isPastDiscovery()) {
            return;
        }
        var before = new HashSet<>(instances.keySet());
        discover();
        if (state == KernelState.RUNNING || state == KernelState.IDLE) {
            var created = instances.values().stream().filter(live -> !before.contains(live.resource().id())).toList();
            runInstances(created);
        }
    }

    private boolean isPastDiscovery() {
        return state == KernelState.DISCOVERED || state == KernelState.RUNNING || state == KernelState.IDLE;
    }

    // ----- teardown ------------------------------------------------------------------------------------------

    /**
     * Tears down every live instance in reverse creation order.
     */
    public void teardownResources() {
        var failures = new ArrayList<RuntimeException>();
        var ids = new ArrayList<>(instances.keySet());
        for (int i = ids.size() - 1; i >= 0; i--) {
            if (instances.containsKey(ids.get(i)) || children.containsKey(ids.get(i))) {
                teardownResource(ids.get(i), failures);
            }
        }
        children.clear();
        throwFirst(failures);
    }

    /**
     * Tears down one resource after its children.
     */
    public void teardownResource(ResourceId id) {
        var failures = new ArrayList<RuntimeException>();
        teardownResource(id, failures);
        throwFirst(failures);
    }

    private void teardownResource(ResourceId id, List<RuntimeException> failures) {
        var owned = children.remove(id);
        if (owned != null) {
            for (int i = owned.size() - 1; i >= 0; i--) {
                teardownResource(owned.get(i), failures);
            }
        }
        var live = instances.remove(id);
        if (live == null) {
            return;
        }
        try {
            live.instance().teardown();
        } catch (Exception ex) {
            LOG.error("Teardown of {} failed: {}", id, KernelException.describe(ex));
            failures.add(new KernelException(
                ErrorCode.ERR_EXECUTION_FAILED,
                id,
                "Teardown of " + id + " failed: " + KernelException.describe(ex),
                ex
            ));
        }
        try {
            publish(id.kind() + "." + TEARDOWN, describe(id));
        } catch (RuntimeException ex) {
            failures.add(ex);
        }
        LOG.debug("Tore down {}", id);
    }

    // ----- hot reload --------------------------------------------------------------------------------------

    /**
     * Replaces every resource that came from {@code location} with its current content. The new content is
     * parsed before anything is torn down.
     */
    public void reloadSource(String location) {
        requireState("reload", KernelState.DISCOVERED, KernelState.RUNNING, KernelState.IDLE);
        var fresh = manifestLoader.load(location);
        var source = manifestLoader.sourceOf(location);
        var stale = new LinkedHashSet<ResourceId>();
        for (var resource : registry.all()) {
            if (belongsTo(resource.source(), source)) {
                stale.add(resource.id());
            }
        }
        var pending = new ArrayDeque<>(stale);
        while (!pending.isEmpty()) {
            for (var child : children.getOrDefault(pending.poll(), List.of())) {
                if (stale.add(child)) {
                    pending.add(child);
                }
            }
        }

        var live = new ArrayList<>(instances.keySet());
        for (int i = live.size() - 1; i >= 0; i--) {
            if (stale.contains(live.get(i))) {
                teardownResource(live.get(i));
            }
        }
        for (var id : stale) {
            registry.unregister(id);
            unhandled.remove(id);
            children.remove(id);
        }
        children.values().forEach(owned -> owned.removeAll(stale));
        LOG.info("Reloading {}: {} resource(s) replaced by {} document(s)", source, stale.size(), fresh.size());
        admit(fresh, null);
    }

    // ----- dispatch ------------------------------------------------------------------------------------------

    public Object invoke(String kind, String name, Object input) {
        var id = new ResourceId(kind, name);
        var live = instances.get(id);
        if (live == null) {
            throw new KernelException(ErrorCode.ERR_RESOURCE_NOT_FOUND, id, "Resource not found: " + id, null);
        }
        Object result;
        try {
            result = live.instance().invoke(input);
        } catch (KernelException ex) {
            if (ex.code() == ErrorCode.ERR_RESOURCE_NOT_INVOKABLE) {
                throw new KernelException(ex.code(), id, "Resource " + id + " is not invokable", ex);
            }
            throw new KernelException(ErrorCode.ERR_EXECUTION_FAILED, id, "Invocation of " + id + " failed: " + ex.getMessage(), ex);
        } catch (Exception ex) {
            throw new KernelException(
                ErrorCode.ERR_EXECUTION_FAILED,
                id,
                "Invocation of " + id + " failed: " + KernelException.describe(ex),
                ex
            );
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("name", name);
        payload.put("input", input);
        payload.put("result", result);
        publish(kind + "." + INVOKED, payload);
        return result;
    }

    /**
     * Dispatches {@code urn} ({@code Kind.Name}) to the {@code execute} capability of its kind's controller.
     */
    public Object execute(String urn, Object input) {
        return execute(urn, input, null);
    }

    Object execute(String urn, Object input, ExecutionContext parent) {
        var id = ResourceId.parse(urn);
        var resource = registry.get(id).orElseThrow(() ->
            new KernelException(ErrorCode.ERR_RESOURCE_NOT_FOUND, id, "Resource not found: " + id, null));
        Controller controller;
        try {
            controller = controllers.find(id.kind()).orElse(null);
        } catch (KernelException ex) {
            throw new KernelException(
                ErrorCode.ERR_MODULE_MISSING,
                id,
                "Controller for kind " + id.kind() + " could not be loaded: " + ex.getMessage(),
                ex
            );
        }
        if (controller == null) {
            throw new KernelException(ErrorCode.ERR_MODULE_MISSING, id, "No controller registered for kind " + id.kind(), null);
        }
        var executor = controller.executor().orElseThrow(() -> new KernelException(
            ErrorCode.ERR_MODULE_MISSING,
            id,
            "Controller for kind " + id.kind() + " does not support execute",
            null
        ));
        var context = parent == null ? new ExecutionContext(this, resource, 0, null) : parent.child(resource);
        try {
            return executor.execute(id.name(), input, context);
        } catch (Exception ex) {
            throw new KernelException(
                ErrorCode.ERR_EXECUTION_FAILED,
                id,
                "Execution of " + id + " failed: " + KernelException.describe(ex),
                ex
            );
        }
    }

    // ----- events and holds ----------------------------------------------------------------------------------

    public void on(String event, EventHandler handler) {
        events.on(event, handler);
    }

    public void once(String event, EventHandler handler) {
        events.once(event, handler);
    }

    public void off(String event, EventHandler handler) {
        events.off(event, handler);
    }

    public void emitRuntimeEvent(String event, Object payload) {
        publish(event, payload);
    }

    /**
     * Emits {@code <Kind>.<event>} on behalf of a resource. Lifecycle event names are reserved.
     */
    public void emitResourceEvent(String kind, String name, String event, Object payload) {
        if (RESERVED_EVENTS.contains(event)) {
            throw new KernelException(
                ErrorCode.ERR_RESERVED_EVENT,
                new ResourceId(kind, name),
                "Event " + event + " is reserved for the kernel",
                null
            );
        }
        var wrapped = new LinkedHashMap<String, Object>();
        wrapped.put("resource", describe(new ResourceId(kind, name)));
        wrapped.put("payload", payload);
        publish(kind + "." + event, wrapped);
    }

    public Hold acquireHold(String reason) {
        return holds.acquire(reason);
    }

    public int holdCount() {
        return holds.count();
    }

    public CompletableFuture<Void> waitForIdle() {
        return holds.waitForIdle();
    }

    /**
     * Stops waiting for holds; a running {@link #start()} proceeds to teardown.
     */
    public void shutdown() {
        LOG.info("Shutdown requested with {} hold(s) outstanding", holds.count());
        holds.releaseWaiters();
    }

    /**
     * Records an exit code; the highest requested code wins.
     */
    public void requestExit(int code) {
        exitCode.accumulateAndGet(code, Math::max);
    }

    public int exitCode() {
        return exitCode.get();
    }

    /**
     * Waits until the kernel has stopped or failed to boot.
     *
     * @return {@code true} when the kernel terminated within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        try {
            termination.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException ex) {
            return false;
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Kernel termination failed", ex.getCause());
        }
    }

    public void enableEventStream(Path file) throws IOException {
        var previous = eventStream;
        eventStream = new EventStream(file);
        if (previous != null) {
            previous.close();
        }
    }

    private void publish(String event, Object payload) {
        var stream = eventStream;
        if (stream != null) {
            try {
                stream.append(event, payload);
            } catch (IOException ex) {
                LOG.warn("Unable to record {} in the event stream: {}", event, ex.getMessage());
            }
        }
        events.emit(event, payload);
    }

    private void publishQuietly(String event, Object payload) {
        try {
            publish(event, payload);
        } catch (RuntimeException ex) {
            LOG.warn("Handler for {} failed: {}", event, KernelException.describe(ex));
        }
    }

    // ----- registration and introspection --------------------------------------------------------------------

    public void registerDefinition(ResourceDefinition definition) {
        controllers.registerDefinition(definition);
    }

    public void registerController(String kind, Controller controller) {
        controllers.registerController(kind, controller);
    }

    /**
     * Defines {@code definition}'s kind and binds {@code controller} to it.
     */
    public void define(ResourceDefinition definition, Controller controller) {
        controllers.register(definition, controller);
    }

    public Object evaluate(String expression, Map<String, Object> scope) {
        return evaluator.evaluate(expression, scope);
    }

    public Object expand(Object value, Map<String, Object> scope) {
        return interpolator.expand(value, scope);
    }

    public Map<String, Object> snapshot() {
        return SnapshotSerializer.capture(registry, id -> {
            var live = instances.get(id);
            return live == null ? null : live.instance();
        });
    }

    public void writeSnapshot(Path file) throws IOException {
        SnapshotSerializer.write(snapshot(), file);
    }

    public Optional<ResourceInstance> instance(String kind, String name) {
        return Optional.ofNullable(instances.get(new ResourceId(kind, name))).map(LiveResource::instance);
    }

    public List<ResourceInstance> instances(String kind) {
        return instances.values().stream()
            .filter(live -> live.resource().kind().equals(kind))
            .map(LiveResource::instance)
            .toList();
    }

    /**
     * Live resources in creation order.
     */
    public List<ResourceId> liveResources() {
        return new ArrayList<>(instances.keySet());
    }

    public List<ResourceId> childrenOf(ResourceId parent) {
        return List.copyOf(children.getOrDefault(parent, List.of()));
    }

    public ResourceRegistry registry() {
        return registry;
    }

    public ControllerRegistry controllers() {
        return controllers;
    }

    public ManifestLoader manifestLoader() {
        return manifestLoader;
    }

    public KernelSettings settings() {
        return settings;
    }

    public KernelState state() {
        return state;
    }

    @Override
    public void close() {
        var stream = eventStream;
        eventStream = null;
        try {
            if (stream != null) {
                stream.close();
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to close the event stream", ex);
        } finally {
            evaluator.close();
        }
    }

    private void requireState(String operation, KernelState... allowed) {
        for (var candidate : allowed) {
            if (state == candidate) {
                return;
            }
        }
        throw new KernelException(
            ErrorCode.ERR_INVALID_STATE,
            "Cannot " + operation + " while the kernel is " + state + " (expected one of " + Arrays.toString(allowed) + ")"
        );
    }

    private static boolean belongsTo(String resourceSource, String source) {
        if (resourceSource == null) {
            return false;
        }
        return resourceSource.equals(source) || resourceSource.startsWith(source + File.separator);
    }

    private static Map<String, Object> describe(ResourceId id) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("kind", id.kind());
        payload.put("name", id.name());
        return payload;
    }

    private static RuntimeException merge(RuntimeException first, RuntimeException next) {
        if (first == null) {
            return next;
        }
        first.addSuppressed(next);
        return first;
    }

    private static void throwFirst(List<RuntimeException> failures) {
        if (failures.isEmpty()) {
            return;
        }
        var first = failures.get(0);
        failures.stream().skip(1).forEach(first::addSuppressed);
        throw first;
    }

    private record LiveResource(Resource resource, ResourceInstance instance) {}

    private class KernelControllerContext implements ControllerContext {
        private final String kind;

        KernelControllerContext(String kind) {
            this.kind = kind;
        }

        @Override
        public String kind() {
            return kind;
        }

        @Override
        public void on(String event, EventHandler handler) {
            events.on(event, handler);
        }

        @Override
        public void once(String event, EventHandler handler) {
            events.once(event, handler);
        }

        @Override
        public void off(String event, EventHandler handler) {
            events.off(event, handler);
        }

        @Override
        public void emit(String event, Object payload) {
            publish(event.contains(".") ? event : kind + "." + event, payload);
        }

        @Override
        public Hold acquireHold(String reason) {
            return holds.acquire(reason);
        }

        @Override
        public Object evaluate(String expression, Map<String, Object> scope) {
            return evaluator.evaluate(expression, scope);
        }

        @Override
        public Object expand(Object value, Map<String, Object> scope) {
            return interpolator.expand(value, scope);
        }

        @Override
        public void requestExit(int code) {
            Kernel.this.requestExit(code);
        }
    }

    private final class KernelResourceContext extends KernelControllerContext implements ResourceContext {
        private final ResourceId id;

        KernelResourceContext(ResourceId id) {
            super(id.kind());
            this.id = id;
        }

        @Override
        public ResourceId resourceId() {
            return id;
        }

        @Override
        public void registerManifest(Map<String, Object> document) {
            registerManifests(List.of(document));
        }

        @Override
        public void registerManifests(List<Map<String, Object>> documents) {
            var parent = registry.get(id).orElse(null);
            var resources = new ArrayList<Resource>();
            for (var document : documents) {
                var resource = Resource.of(document);
                if (parent != null) {
                    if (resource.module() == null && parent.module() != null) {
                        resource = resource.withMetadata(Resource.MODULE, parent.module());
                    }
                    if (resource.source() == null && parent.source() != null) {
                        resource = resource.withMetadata(Resource.SOURCE, parent.source());
                    }
                    if (resource.uri() == null) {
                        var lineage = parent.uri() != null ? parent.uri() : id.toString();
                        resource = resource.withMetadata(Resource.URI, ResourceUri.child(lineage, resource.kind(), resource.name()));
                    }
                }
                if (resource.metadata().get(Resource.GENERATION_DEPTH) == null) {
                    resource = resource.withMetadata(Resource.GENERATION_DEPTH, parent == null ? 0 : parent.generationDepth());
                }
                resources.add(resource);
            }
            admit(resources, id);
        }

        @Override
        public void registerDefinition(ResourceDefinition definition) {
            controllers.registerDefinition(definition);
        }

        @Override
        public void registerController(String kind, Controller controller) {
            controllers.registerController(kind, controller);
        }

        @Override
        public Object invoke(String kind, String name, Object input) {
            return Kernel.this.invoke(kind, name, input);
        }

        @Override
        public Object execute(String urn, Object input) {
            return Kernel.this.execute(urn, input, null);
        }

        @Override
        public Optional<ResourceInstance> getInstance(String kind, String name) {
            return instance(kind, name);
        }

        @Override
        public List<ResourceInstance> getInstances(String kind) {
            return instances(kind);
        }

        @Override
        public void emitEvent(String event, Object payload) {
            emitResourceEvent(id.kind(), id.name(), event, payload);
        }

        @Override
        public void validate(Object value, Map<String, Object> schema) {
            SchemaValidator.validate(id, value, schema);
        }

        @Override
        public ManifestLoader manifestLoader() {
            return manifestLoader;
        }
    }
}
