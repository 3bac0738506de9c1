package run.telo.kernel.controllers;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import run.telo.kernel.runtime.ErrorCode;
import run.telo.kernel.runtime.KernelException;
import run.telo.kernel.runtime.ManifestLoader;
import run.telo.kernel.runtime.Resource;
import run.telo.kernel.runtime.ResourceContext;
import run.telo.kernel.runtime.ResourceInstance;
import run.telo.kernel.shared.Values;

/**
 * {@code Runtime.Module}: pulls in the manifests listed under {@code imports}, {@code definitions} and
 * {@code resources} and registers them as its children. The module itself leaves no live instance.
 */
final class ModuleController {
    private static final Logger LOG = LoggerFactory.getLogger(ModuleController.class);
    private static final List<String> SECTIONS = List.of("imports", "definitions", "resources");

    private ModuleController() {}

    static ResourceInstance create(Resource module, ResourceContext context) {
        var documents = new ArrayList<Map<String, Object>>();
        try {
            for (var section : SECTIONS) {
                for (var entry : Values.asList(module.get(section))) {
                    var location = resolve(module, pathOf(entry, section));
                    for (var resource : context.manifestLoader().load(location)) {
                        documents.add(withModule(resource, module.name()));
                    }
                }
            }
        } catch (KernelException ex) {
            throw new KernelException(
                ex.code(),
                module.id(),
                "Failed to process Module \"" + module.name() + "\": " + ex.getMessage(),
                ex
            );
        }
        LOG.debug("Module {} contributes {} resource(s)", module.name(), documents.size());
        if (!documents.isEmpty()) {
            context.registerManifests(documents);
        }
        return null;
    }

    private static String pathOf(Object entry, String section) {
        if (entry instanceof String text && !text.isBlank()) {
            return text;
        }
        if (entry instanceof Map<?, ?> map && map.get("path") instanceof String text && !text.isBlank()) {
            return text;
        }
        throw new KernelException(
            ErrorCode.ERR_INVALID_RESOURCE,
            "Entries of " + section + " must be paths or {path} mappings (got " + entry + ")"
        );
    }

    /**
     * Resolves {@code path} against the directory of the module's own manifest.
     */
    static String resolve(Resource module, String path) {
        if (path.startsWith("http://") || path.startsWith("https://") || path.contains("${{")) {
            return path;
        }
        var source = module.source();
        if (source == null) {
            return Path.of(path).toAbsolutePath().normalize().toString();
        }
        if (source.startsWith("http://") || source.startsWith("https://")) {
            return URI.create(source).resolve(path).toString();
        }
        var parent = Path.of(source).toAbsolutePath().getParent();
        var resolved = parent == null ? Path.of(path) : parent.resolve(path);
        return resolved.normalize().toString();
    }

    private static Map<String, Object> withModule(Resource resource, String moduleName) {
        if (resource.module() != null || ManifestLoader.MODULE_KIND.equals(resource.kind())) {
            return resource.toMap();
        }
        return resource.withMetadata(Resource.MODULE, moduleName).toMap();
    }
}
