package run.telo.kernel.expression;

import java.util.Objects;

/**
 * Outcome of evaluating one interpolation: a value, a deliberate deferral, or a failure.
 */
public record Evaluation(Status status, Object value, ExpressionException error) {
    public enum Status {
        RESOLVED,
        DEFERRED,
        FAILED
    }

    public static Evaluation resolved(Object value) {
        return new Evaluation(Status.RESOLVED, value, null);
    }

    public static Evaluation deferred() {
        return new Evaluation(Status.DEFERRED, null, null);
    }

    public static Evaluation failed(ExpressionException error) {
        return new Evaluation(Status.FAILED, null, Objects.requireNonNull(error, "error"));
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }

    public boolean isDeferred() {
        return status == Status.DEFERRED;
    }
}
