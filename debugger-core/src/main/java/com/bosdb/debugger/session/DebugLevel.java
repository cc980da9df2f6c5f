package com.bosdb.debugger.session;

/**
 * Amount of instrumentation a session asks for. Ordered from least to most.
 */
public enum DebugLevel {
    PRODUCTION,
    MINIMAL,
    NORMAL,
    VERBOSE,
    MAXIMUM;

    public boolean isAtLeast(DebugLevel other) {
        return compareTo(other) >= 0;
    }
}
