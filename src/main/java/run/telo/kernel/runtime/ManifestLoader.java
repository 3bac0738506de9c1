package run.telo.kernel.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import run.telo.kernel.shared.Values;

/**
 * Loads manifest documents from YAML files, directories of YAML files, or HTTP(S) URLs.
 *
 * <p>Every document gets {@code metadata.source}, {@code metadata.uri} and {@code metadata.generationDepth: 0}.
 * The first {@code Runtime.Module} of a file names the module of the other documents in that file, and a
 * {@code Self.} kind prefix is replaced by that name.
 */
public final class ManifestLoader {
    public static final String MODULE_KIND = "Runtime.Module";
    private static final String SELF_PREFIX = "Self.";
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Pattern ENV_REFERENCE = Pattern.compile("\\$\\{\\{\\s*env\\.([A-Za-z_][A-Za-z0-9_]*)\\s*\\}\\}");
    private static final Logger LOG = LoggerFactory.getLogger(ManifestLoader.class);

    private final Set<String> allowedEnvironment;
    private final Map<String, String> environment;
    private final HttpClient httpClient;

    public ManifestLoader(List<String> allowedEnvironment) {
        this(allowedEnvironment, System.getenv());
    }

    public ManifestLoader(List<String> allowedEnvironment, Map<String, String> environment) {
        this.allowedEnvironment = Set.copyOf(allowedEnvironment);
        this.environment = Map.copyOf(environment);
        this.httpClient = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build();
    }

    /**
     * Loads a path or HTTP(S) URL, after substituting {@code ${{ env.NAME }}} references.
     */
    public List<Resource> load(String location) {
        var resolved = substituteEnvironment(location);
        if (resolved.startsWith("http://") || resolved.startsWith("https://")) {
            return loadFromHttp(URI.create(resolved));
        }
        return load(Path.of(resolved));
    }

    /**
     * The {@code metadata.source} recorded for documents loaded from {@code location}. For a directory, the
     * documents carry the paths of the files below it.
     */
    public String sourceOf(String location) {
        var resolved = substituteEnvironment(location);
        if (resolved.startsWith("http://") || resolved.startsWith("https://")) {
            return URI.create(resolved).toString();
        }
        return Path.of(resolved).toAbsolutePath().normalize().toString();
    }

    public List<Resource> load(Path path) {
        var normalized = path.toAbsolutePath().normalize();
        if (Files.isDirectory(normalized)) {
            return loadDirectory(normalized);
        }
        if (!Files.isRegularFile(normalized)) {
            throw new KernelException(ErrorCode.ERR_MANIFEST_LOAD, "Manifest not found: " + normalized);
        }
        try {
            var content = Files.readString(normalized, StandardCharsets.UTF_8);
            return parse(content, normalized.toString(), normalized.toUri().toString());
        } catch (IOException ex) {
            throw new KernelException(ErrorCode.ERR_MANIFEST_LOAD, "Failed to read manifest: " + normalized, ex);
        }
    }

    public List<Resource> loadFromHttp(URI uri) {
        try {
            var request = HttpRequest.newBuilder(uri).GET().build();
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() >= 400) {
                throw new KernelException(
                    ErrorCode.ERR_MANIFEST_LOAD,
                    "HTTP " + response.statusCode() + " while downloading manifest: " + uri
                );
            }
            return parse(response.body(), uri.toString(), uri.toString());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new KernelException(ErrorCode.ERR_MANIFEST_LOAD, "Interrupted while downloading manifest: " + uri, ex);
        } catch (IOException ex) {
            throw new KernelException(ErrorCode.ERR_MANIFEST_LOAD, "Failed to download manifest: " + uri, ex);
        }
    }

    /**
     * Parses multi-document YAML.
     *
     * @param source recorded as {@code metadata.source}
     * @param location base of {@code metadata.uri}
     */
    public List<Resource> parse(String content, String source, String location) {
        var documents = new ArrayList<Map<String, Object>>();
        try (var parser = YAML_MAPPER.getFactory().createParser(content)) {
            MappingIterator<JsonNode> iterator = YAML_MAPPER.readValues(parser, JsonNode.class);
            while (iterator.hasNextValue()) {
                var node = iterator.nextValue();
                if (node != null && node.isObject()) {
                    documents.add(toMap(node));
                }
            }
        } catch (IOException ex) {
            throw new KernelException(ErrorCode.ERR_MANIFEST_LOAD, "Invalid YAML in " + source + ": " + ex.getMessage(), ex);
        }

        var module = documents.stream()
            .filter(doc -> MODULE_KIND.equals(doc.get(Resource.KIND)))
            .map(doc -> Values.asString(Values.asMap(doc.get(Resource.METADATA)).get(Resource.NAME)))
            .filter(name -> name != null && !name.isBlank())
            .findFirst()
            .orElse(null);

        var resources = new ArrayList<Resource>();
        for (var document : documents) {
            resources.add(annotate(document, module, source, location));
        }
        LOG.debug("Loaded {} document(s) from {}", resources.size(), source);
        return resources;
    }

    private Resource annotate(Map<String, Object> document, String module, String source, String location) {
        var kind = document.get(Resource.KIND);
        if (kind instanceof String text && text.startsWith(SELF_PREFIX)) {
            if (module == null) {
                throw new KernelException(
                    ErrorCode.ERR_INVALID_RESOURCE,
                    "Kind " + text + " uses Self. but " + source + " declares no " + MODULE_KIND
                );
            }
            document.put(Resource.KIND, module + "." + text.substring(SELF_PREFIX.length()));
        }
        Resource resource;
        try {
            resource = Resource.of(document);
        } catch (KernelException ex) {
            throw new KernelException(ex.code(), ex.getMessage() + " (in " + source + ")", ex);
        }
        var metadata = new LinkedHashMap<>(resource.metadata());
        if (module != null && !MODULE_KIND.equals(resource.kind())) {
            metadata.putIfAbsent(Resource.MODULE, module);
        }
        metadata.putIfAbsent(Resource.SOURCE, source);
        metadata.putIfAbsent(Resource.URI, ResourceUri.forLocation(location, resource.kind(), resource.name()));
        metadata.putIfAbsent(Resource.GENERATION_DEPTH, 0);
        var annotated = resource.toMap();
        annotated.put(Resource.METADATA, metadata);
        return Resource.of(annotated);
    }

    private List<Resource> loadDirectory(Path directory) {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile)
                .filter(p -> {
                    var name = p.getFileName().toString();
                    return name.endsWith(".yaml") || name.endsWith(".yml");
                })
                .sorted()
                .toList();
        } catch (IOException ex) {
            throw new KernelException(ErrorCode.ERR_MANIFEST_LOAD, "Failed to list manifests in " + directory, ex);
        }
        var resources = new ArrayList<Resource>();
        for (var file : files) {
            resources.addAll(load(file));
        }
        return resources;
    }

    String substituteEnvironment(String location) {
        Matcher matcher = ENV_REFERENCE.matcher(location);
        var out = new StringBuilder();
        while (matcher.find()) {
            var name = matcher.group(1);
            if (!allowedEnvironment.contains(name)) {
                throw new KernelException(
                    ErrorCode.ERR_MANIFEST_LOAD,
                    "Environment variable " + name + " is not allowed in manifest paths"
                );
            }
            var value = environment.get(name);
            if (value == null) {
                throw new KernelException(ErrorCode.ERR_MANIFEST_LOAD, "Environment variable " + name + " is not set");
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static Map<String, Object> toMap(JsonNode node) {
        var map = new LinkedHashMap<String, Object>();
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            map.put(entry.getKey(), convertNode(entry.getValue()));
        }
        return map;
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            return toMap(node);
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
