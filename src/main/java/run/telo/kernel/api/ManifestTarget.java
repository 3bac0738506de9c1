package run.telo.kernel.api;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Represents the manifest argument (local file, local directory or remote URL).
 */
public record ManifestTarget(Optional<Path> localPath, Optional<URI> remoteUri) {
    public ManifestTarget {
        Objects.requireNonNull(localPath, "localPath");
        Objects.requireNonNull(remoteUri, "remoteUri");
        if (localPath.isEmpty() == remoteUri.isEmpty()) {
            throw new IllegalArgumentException("Exactly one of localPath or remoteUri must be present.");
        }
    }

    public static ManifestTarget forLocal(Path path) {
        return new ManifestTarget(Optional.of(path), Optional.empty());
    }

    public static ManifestTarget forRemote(URI uri) {
        return new ManifestTarget(Optional.empty(), Optional.of(uri));
    }

    /**
     * URLs with an http(s) scheme are remote; anything else is a path.
     */
    public static ManifestTarget parse(String value) {
        Objects.requireNonNull(value, "value");
        if (value.startsWith("http://") || value.startsWith("https://")) {
            return forRemote(URI.create(value));
        }
        return forLocal(Path.of(value));
    }

    public boolean isRemote() {
        return remoteUri.isPresent();
    }

    /**
     * Location handed to the manifest loader; relative paths resolve against {@code workingDirectory}.
     */
    public String location(Path workingDirectory) {
        if (remoteUri.isPresent()) {
            return remoteUri.get().toString();
        }
        var path = localPath.orElseThrow();
        return (path.isAbsolute() ? path : workingDirectory.resolve(path)).normalize().toString();
    }

    public String display() {
        return localPath.map(Path::toString).or(() -> remoteUri.map(URI::toString)).orElse("unknown");
    }
}
