package run.telo.kernel.expression;

import run.telo.kernel.runtime.ErrorCode;
import run.telo.kernel.runtime.KernelException;

/**
 * Raised when an expression cannot be evaluated.
 */
public final class ExpressionException extends KernelException {
    private final String expression;

    public ExpressionException(String expression, String message, Throwable cause) {
        super(ErrorCode.ERR_EXPRESSION_FAILED, "Expression \"" + expression + "\" failed: " + message, cause);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
