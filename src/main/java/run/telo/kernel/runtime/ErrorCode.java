package run.telo.kernel.runtime;

/**
 * Stable error codes surfaced by the kernel.
 */
public enum ErrorCode {
    ERR_RESOURCE_NOT_FOUND,
    ERR_MODULE_MISSING,
    ERR_CONTROLLER_NOT_FOUND,
    ERR_DUPLICATE_RESOURCE,
    ERR_EXECUTION_FAILED,
    ERR_CONTROLLER_INVALID,
    ERR_RESOURCE_NOT_INVOKABLE,
    ERR_INVALID_RESOURCE,
    ERR_DEPENDENCY_CYCLE,
    ERR_SCHEMA_VALIDATION,
    ERR_EXPRESSION_FAILED,
    ERR_TEMPLATE_EXPANSION,
    ERR_RESERVED_EVENT,
    ERR_INVALID_EVENT,
    ERR_EVENT_HANDLER_FAILED,
    ERR_INVALID_STATE,
    ERR_MANIFEST_LOAD
}
