package run.telo.kernel.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import run.telo.kernel.shared.Values;

/**
 * A typed configuration document: {@code kind}, {@code metadata} and free-form fields.
 */
public final class Resource {
    public static final String KIND = "kind";
    public static final String METADATA = "metadata";
    public static final String NAME = "name";
    public static final String MODULE = "module";
    public static final String URI = "uri";
    public static final String SOURCE = "source";
    public static final String GENERATION_DEPTH = "generationDepth";

    private final Map<String, Object> document;

    private Resource(Map<String, Object> document) {
        this.document = document;
    }

    /**
     * Copies {@code document} into a new resource, rejecting documents without a kind or a name.
     */
    public static Resource of(Map<String, ?> document) {
        Objects.requireNonNull(document, "document");
        var copy = Values.copyMap(document);
        var kind = copy.get(KIND);
        if (!(kind instanceof String k) || k.isBlank()) {
            throw new KernelException(ErrorCode.ERR_INVALID_RESOURCE, "Resource is missing a kind: " + summarize(copy));
        }
        var metadata = copy.get(METADATA);
        if (!(metadata instanceof Map<?, ?>)) {
            throw new KernelException(
                ErrorCode.ERR_INVALID_RESOURCE,
                "Resource " + kind + " is missing metadata.name"
            );
        }
        var name = Values.asMap(metadata).get(NAME);
        if (!(name instanceof String n) || n.isBlank()) {
            throw new KernelException(
                ErrorCode.ERR_INVALID_RESOURCE,
                "Resource " + kind + " is missing metadata.name"
            );
        }
        return new Resource(copy);
    }

    public String kind() {
        return (String) document.get(KIND);
    }

    public String name() {
        return (String) meta().get(NAME);
    }

    public ResourceId id() {
        return new ResourceId(kind(), name());
    }

    public String module() {
        return Values.asString(meta().get(MODULE));
    }

    public String uri() {
        return Values.asString(meta().get(URI));
    }

    public String source() {
        return Values.asString(meta().get(SOURCE));
    }

    public int generationDepth() {
        return meta().get(GENERATION_DEPTH) instanceof Number n ? n.intValue() : 0;
    }

    /**
     * A copy of the metadata block; the registered document never changes.
     */
    public Map<String, Object> metadata() {
        return Values.copyMap(meta());
    }

    public Object get(String field) {
        return Values.deepCopy(document.get(field));
    }

    /**
     * Top-level fields other than {@code kind} and {@code metadata}.
     */
    public Map<String, Object> fields() {
        var fields = new LinkedHashMap<String, Object>();
        document.forEach((key, value) -> {
            if (!KIND.equals(key) && !METADATA.equals(key)) {
                fields.put(key, Values.deepCopy(value));
            }
        });
        return fields;
    }

    public Map<String, Object> toMap() {
        return Values.copyMap(document);
    }

    /**
     * Returns a copy with {@code metadata.key} set, or the same resource when the value is unchanged.
     */
    public Resource withMetadata(String key, Object value) {
        if (Objects.equals(meta().get(key), value)) {
            return this;
        }
        var copy = toMap();
        Values.asMap(copy.get(METADATA)).put(key, value);
        return new Resource(copy);
    }

    private Map<String, Object> meta() {
        return Values.asMap(document.get(METADATA));
    }

    private static String summarize(Map<String, Object> document) {
        var keys = document.keySet();
        return keys.isEmpty() ? "{}" : keys.toString();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Resource r && document.equals(r.document);
    }

    @Override
    public int hashCode() {
        return document.hashCode();
    }

    @Override
    public String toString() {
        return id().toString();
    }
}
