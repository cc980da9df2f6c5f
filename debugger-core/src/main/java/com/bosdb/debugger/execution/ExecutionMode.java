package com.bosdb.debugger.execution;

/**
 * Runtime execution flag of a session, distinct from its persisted status.
 */
public enum ExecutionMode {
    /** Statements run until a breakpoint matches */
    RUNNING,
    /** Waiting at an execution point */
    PAUSED,
    /** Will pause again at the next execution point */
    STEPPING,
    /** Nothing left to run (rewound past the first point, or stopped) */
    STOPPED
}
