package me.golemcore.runtime.domain.loop;

/**
 * Why {@link EventDispatcher#run} returned.
 */
public enum DispatchResult {
    CANCELLED, FATAL_UNREGISTERED;

    public int exitCode() {
        return this == FATAL_UNREGISTERED ? 3 : 0;
    }
}
