package me.golemcore.runtime.domain.model;

/**
 * Machine-readable classification of tool call failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * The model produced arguments that are not a JSON object.
     */
    INVALID_ARGUMENTS,

    /**
     * The handler threw or returned something unusable. The cause is logged, the
     * model only sees an opaque message.
     */
    EXECUTION_FAILED,

    /**
     * A human denied the approval request.
     */
    CONFIRMATION_DENIED,

    /**
     * Turn control cancelled the call before its real outcome was delivered.
     */
    CANCELLED,

    /**
     * Child conversations did not all finish before the group deadline.
     */
    SUBCHAT_TIMEOUT
}
