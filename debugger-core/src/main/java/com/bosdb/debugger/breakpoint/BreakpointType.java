package com.bosdb.debugger.breakpoint;

/**
 * Kind of execution event a breakpoint watches.
 */
public enum BreakpointType {
    QUERY,
    LINE,
    DATA,
    TRANSACTION,
    LOCK,
    PLAN;

    public String wireName() {
        return name().toLowerCase();
    }
}
