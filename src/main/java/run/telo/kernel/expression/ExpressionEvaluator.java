package run.telo.kernel.expression;

import java.util.Map;

/**
 * Evaluates one expression against a scope of named values.
 */
@FunctionalInterface
public interface ExpressionEvaluator extends AutoCloseable {
    /**
     * @throws ExpressionException when the expression is malformed or references unknown identifiers
     */
    Object evaluate(String expression, Map<String, Object> scope);

    @Override
    default void close() {}
}
