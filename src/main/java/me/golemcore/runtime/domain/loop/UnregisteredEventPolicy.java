package me.golemcore.runtime.domain.loop;

/**
 * What the dispatcher does with an event no registered handler claims.
 */
public enum UnregisteredEventPolicy {

    /**
     * Stop the loop and exit the process with a non-zero code. The tool set
     * advertised to the model no longer matches what this process can run.
     */
    SHUTDOWN,

    /**
     * Log and leave tool calls pending for whoever claims them. Meant for tests.
     */
    LEAVE_PENDING
}
