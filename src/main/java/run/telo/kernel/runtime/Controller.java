package run.telo.kernel.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Capability set bound to one kind. Every capability is optional; the schema validates resources before
 * {@code create}. An empty schema means none was declared.
 */
public record Controller(
    Optional<Registrar> registrar,
    Optional<Factory> factory,
    Optional<Compiler> compiler,
    Optional<Executor> executor,
    Map<String, Object> schema
) {
    public Controller {
        registrar = registrar == null ? Optional.empty() : registrar;
        factory = factory == null ? Optional.empty() : factory;
        compiler = compiler == null ? Optional.empty() : compiler;
        executor = executor == null ? Optional.empty() : executor;
        schema = schema == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(schema));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasSchema() {
        return !schema.isEmpty();
    }

    /**
     * Copy of this controller using {@code newSchema}; the original is left untouched.
     */
    public Controller withSchema(Map<String, Object> newSchema) {
        return new Controller(registrar, factory, compiler, executor, newSchema);
    }

    @FunctionalInterface
    public interface Registrar {
        void register(ControllerContext context) throws Exception;
    }

    @FunctionalInterface
    public interface Factory {
        /**
         * @return the live instance, or {@code null} when the resource is consumed without one
         */
        ResourceInstance create(Resource resource, ResourceContext context) throws Exception;
    }

    @FunctionalInterface
    public interface Compiler {
        /**
         * @return a replacement resource, or {@code null} to keep the original
         */
        Resource compile(Resource resource, ResourceContext context) throws Exception;
    }

    @FunctionalInterface
    public interface Executor {
        Object execute(String name, Object input, ExecutionContext context) throws Exception;
    }

    public static final class Builder {
        private Registrar registrar;
        private Factory factory;
        private Compiler compiler;
        private Executor executor;
        private Map<String, Object> schema = Map.of();

        public Builder register(Registrar registrar) {
            this.registrar = registrar;
            return this;
        }

        public Builder create(Factory factory) {
            this.factory = factory;
            return this;
        }

        public Builder compile(Compiler compiler) {
            this.compiler = compiler;
            return this;
        }

        public Builder execute(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder schema(Map<String, Object> schema) {
            this.schema = schema;
            return this;
        }

        public Controller build() {
            return new Controller(
                Optional.ofNullable(registrar),
                Optional.ofNullable(factory),
                Optional.ofNullable(compiler),
                Optional.ofNullable(executor),
                schema
            );
        }
    }
}
