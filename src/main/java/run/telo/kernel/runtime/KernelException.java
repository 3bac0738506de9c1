package run.telo.kernel.runtime;

import java.util.Objects;
import java.util.Optional;

/**
 * Exception carrying a kernel {@link ErrorCode} and, when known, the resource it concerns.
 */
public class KernelException extends RuntimeException {
    private final ErrorCode code;
    private final ResourceId resource;

    public KernelException(ErrorCode code, String message) {
        this(code, null, message, null);
    }

    public KernelException(ErrorCode code, String message, Throwable cause) {
        this(code, null, message, cause);
    }

    public KernelException(ErrorCode code, ResourceId resource, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.resource = resource;
    }

    public ErrorCode code() {
        return code;
    }

    public Optional<ResourceId> resource() {
        return Optional.ofNullable(resource);
    }

    /**
     * Message of a failure, falling back to the exception type when it carries none.
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return "Unexpected error";
        }
        var message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
