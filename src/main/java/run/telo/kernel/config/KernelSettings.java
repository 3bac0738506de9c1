package run.telo.kernel.config;

import java.util.List;
import java.util.Objects;

/**
 * Tunable limits and expression policy of a kernel instance.
 */
public record KernelSettings(
    int maxDiscoveryPasses,
    int maxResolutionPasses,
    int maxExpansionDepth,
    int maxExpansionPasses,
    List<String> allowedEnvironment,
    List<String> deferredRoots
) {
    public static final List<String> DEFAULT_ALLOWED_ENVIRONMENT =
        List.of("PORT", "HOST", "PATH", "HOME", "USER", "LANG", "TELO_ENV");
    public static final List<String> DEFAULT_DEFERRED_ROOTS = List.of("request", "result");

    public KernelSettings {
        requirePositive(maxDiscoveryPasses, "maxDiscoveryPasses");
        requirePositive(maxResolutionPasses, "maxResolutionPasses");
        requirePositive(maxExpansionDepth, "maxExpansionDepth");
        requirePositive(maxExpansionPasses, "maxExpansionPasses");
        allowedEnvironment = List.copyOf(Objects.requireNonNull(allowedEnvironment, "allowedEnvironment"));
        deferredRoots = List.copyOf(Objects.requireNonNull(deferredRoots, "deferredRoots"));
    }

    public static KernelSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .maxDiscoveryPasses(maxDiscoveryPasses)
            .maxResolutionPasses(maxResolutionPasses)
            .maxExpansionDepth(maxExpansionDepth)
            .maxExpansionPasses(maxExpansionPasses)
            .allowedEnvironment(allowedEnvironment)
            .deferredRoots(deferredRoots);
    }

    private static void requirePositive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be at least 1 (got " + value + ")");
        }
    }

    public static final class Builder {
        private int maxDiscoveryPasses = 10;
        private int maxResolutionPasses = 5;
        private int maxExpansionDepth = 10;
        private int maxExpansionPasses = 10;
        private List<String> allowedEnvironment = DEFAULT_ALLOWED_ENVIRONMENT;
        private List<String> deferredRoots = DEFAULT_DEFERRED_ROOTS;

        public Builder maxDiscoveryPasses(int maxDiscoveryPasses) {
            this.maxDiscoveryPasses = maxDiscoveryPasses;
            return this;
        }

        public Builder maxResolutionPasses(int maxResolutionPasses) {
            this.maxResolutionPasses = maxResolutionPasses;
            return this;
        }

        public Builder maxExpansionDepth(int maxExpansionDepth) {
            this.maxExpansionDepth = maxExpansionDepth;
            return this;
        }

        public Builder maxExpansionPasses(int maxExpansionPasses) {
            this.maxExpansionPasses = maxExpansionPasses;
            return this;
        }

        public Builder allowedEnvironment(List<String> allowedEnvironment) {
            this.allowedEnvironment = allowedEnvironment;
            return this;
        }

        public Builder deferredRoots(List<String> deferredRoots) {
            this.deferredRoots = deferredRoots;
            return this;
        }

        public KernelSettings build() {
            return new KernelSettings(
                maxDiscoveryPasses,
                maxResolutionPasses,
                maxExpansionDepth,
                maxExpansionPasses,
                allowedEnvironment,
                deferredRoots
            );
        }
    }
}
