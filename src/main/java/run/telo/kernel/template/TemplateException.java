package run.telo.kernel.template;

import run.telo.kernel.runtime.ErrorCode;
import run.telo.kernel.runtime.KernelException;

/**
 * Fatal template expansion error, always naming the template and the depth it occurred at.
 */
public final class TemplateException extends KernelException {
    public enum Reason {
        MAX_EXPANSION_DEPTH_EXCEEDED,
        INVALID_FOR_EXPRESSION,
        INVALID_FOR_TARGET,
        INVALID_BLUEPRINT,
        TEMPLATE_EXPANSION_INCOMPLETE,
        MISSING_PARAMETER,
        EXPRESSION_FAILED
    }

    private final Reason reason;
    private final String template;
    private final int depth;

    public TemplateException(Reason reason, String template, int depth, String message) {
        this(reason, template, depth, message, null);
    }

    public TemplateException(Reason reason, String template, int depth, String message, Throwable cause) {
        super(ErrorCode.ERR_TEMPLATE_EXPANSION, "Template " + template + " (depth " + depth + "): " + message, cause);
        this.reason = reason;
        this.template = template;
        this.depth = depth;
    }

    public Reason reason() {
        return reason;
    }

    public String template() {
        return template;
    }

    public int depth() {
        return depth;
    }
}
