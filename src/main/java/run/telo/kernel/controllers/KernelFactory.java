package run.telo.kernel.controllers;

import run.telo.kernel.config.KernelSettings;
import run.telo.kernel.expression.JsExpressionEvaluator;
import run.telo.kernel.runtime.Kernel;

/**
 * Builds kernels wired with the JavaScript expression engine and the built-in kinds.
 */
public final class KernelFactory {
    private KernelFactory() {}

    public static Kernel create() {
        return create(KernelSettings.defaults());
    }

    public static Kernel create(KernelSettings settings) {
        return BuiltinControllers.install(new Kernel(settings, new JsExpressionEvaluator()));
    }
}
