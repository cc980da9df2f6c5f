package com.bosdb.debugger.session;

/**
 * Persisted status of a debug session.
 */
public enum SessionStatus {
    RUNNING,
    PAUSED,
    STOPPED,
    ERROR;

    public String wireName() {
        return name().toLowerCase();
    }
}
