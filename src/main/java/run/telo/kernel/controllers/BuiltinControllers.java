package run.telo.kernel.controllers;

import java.util.Map;
import run.telo.kernel.runtime.Controller;
import run.telo.kernel.runtime.Kernel;
import run.telo.kernel.runtime.ManifestLoader;
import run.telo.kernel.runtime.ResourceDefinition;
import run.telo.kernel.template.TemplateDefinition;

/**
 * Kinds every kernel understands: {@code Runtime.Definition}, {@code Runtime.Module} and {@code TemplateDefinition}.
 */
public final class BuiltinControllers {
    private static final Map<String, Object> OPEN_OBJECT = Map.of("type", "object");

    private BuiltinControllers() {}

    public static Kernel install(Kernel kernel) {
        kernel.define(
            ResourceDefinition.of(ResourceDefinition.KIND, OPEN_OBJECT),
            Controller.builder().create(ResourceDefinitionController::create).build()
        );
        kernel.define(
            ResourceDefinition.of(ManifestLoader.MODULE_KIND, OPEN_OBJECT),
            Controller.builder().create(ModuleController::create).build()
        );
        kernel.define(
            ResourceDefinition.of(TemplateDefinition.KIND, OPEN_OBJECT),
            Controller.builder().create(TemplateDefinitionController::create).build()
        );
        return kernel;
    }
}
