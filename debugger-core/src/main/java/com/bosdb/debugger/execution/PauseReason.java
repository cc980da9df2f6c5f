package com.bosdb.debugger.execution;

/**
 * Why execution stopped at an execution point.
 */
public enum PauseReason {
    BREAKPOINT,
    STEP,
    PAUSE,
    EXCEPTION,
    ERROR;

    public String wireName() {
        return name().toLowerCase();
    }
}
