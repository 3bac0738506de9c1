package run.telo.kernel.runtime;

import java.util.Objects;

/**
 * Identity of a resource inside one kernel: its kind plus its name, rendered {@code Kind.Name}.
 */
public record ResourceId(String kind, String name) {
    public ResourceId {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
    }

    /**
     * Parses {@code Kind.Name}; the name is the segment after the last dot.
     */
    public static ResourceId parse(String urn) {
        if (urn == null) {
            throw new KernelException(ErrorCode.ERR_RESOURCE_NOT_FOUND, "Resource reference is missing");
        }
        int dot = urn.lastIndexOf('.');
        if (dot <= 0 || dot == urn.length() - 1) {
            throw new KernelException(ErrorCode.ERR_RESOURCE_NOT_FOUND, "Invalid resource reference: " + urn);
        }
        return new ResourceId(urn.substring(0, dot), urn.substring(dot + 1));
    }

    @Override
    public String toString() {
        return kind + "." + name;
    }
}
