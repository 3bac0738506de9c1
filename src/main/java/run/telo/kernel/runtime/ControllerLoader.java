package run.telo.kernel.runtime;

import java.lang.reflect.InvocationTargetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Instantiates the {@link ControllerProvider} named by a definition's Java entrypoints.
 */
final class ControllerLoader {
    private static final Logger LOG = LoggerFactory.getLogger(ControllerLoader.class);

    private final ClassLoader classLoader;

    ControllerLoader(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    Controller load(ResourceDefinition definition) {
        var kind = definition.qualifiedKind();
        KernelException lastFailure = null;
        for (var entrypoint : definition.entrypoints()) {
            try {
                var provider = instantiate(entrypoint);
                var controller = provider.controller(definition);
                if (controller == null) {
                    throw new KernelException(
                        ErrorCode.ERR_CONTROLLER_INVALID,
                        "Entrypoint " + entrypoint + " returned no controller for " + kind
                    );
                }
                LOG.debug("Loaded controller for {} from {}", kind, entrypoint);
                return controller;
            } catch (KernelException ex) {
                LOG.debug("Entrypoint {} for {} rejected: {}", entrypoint, kind, ex.getMessage());
                lastFailure = ex;
            }
        }
        if (lastFailure != null) {
            throw lastFailure;
        }
        throw new KernelException(ErrorCode.ERR_CONTROLLER_NOT_FOUND, "No Java controller entrypoint declared for " + kind);
    }

    private ControllerProvider instantiate(String entrypoint) {
        Class<?> type;
        try {
            type = Class.forName(entrypoint, true, classLoader);
        } catch (ClassNotFoundException ex) {
            throw new KernelException(ErrorCode.ERR_CONTROLLER_INVALID, "Controller class not found: " + entrypoint, ex);
        }
        if (!ControllerProvider.class.isAssignableFrom(type)) {
            throw new KernelException(
                ErrorCode.ERR_CONTROLLER_INVALID,
                "Controller class " + entrypoint + " does not implement " + ControllerProvider.class.getSimpleName()
            );
        }
        try {
            return (ControllerProvider) type.getDeclaredConstructor().newInstance();
        } catch (InvocationTargetException ex) {
            throw new KernelException(
                ErrorCode.ERR_CONTROLLER_INVALID,
                "Controller class " + entrypoint + " failed to initialize: " + KernelException.describe(ex.getCause()),
                ex.getCause()
            );
        } catch (ReflectiveOperationException ex) {
            throw new KernelException(
                ErrorCode.ERR_CONTROLLER_INVALID,
                "Controller class " + entrypoint + " cannot be instantiated: " + KernelException.describe(ex),
                ex
            );
        }
    }
}
