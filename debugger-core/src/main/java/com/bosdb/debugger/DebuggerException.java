package com.bosdb.debugger;

/**
 * Base exception for debug engine failures.
 */
public class DebuggerException extends RuntimeException {

    public DebuggerException(String message) {
        super(message);
    }

    public DebuggerException(String message, Throwable cause) {
        super(message, cause);
    }
}
