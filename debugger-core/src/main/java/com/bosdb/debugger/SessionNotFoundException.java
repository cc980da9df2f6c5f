package com.bosdb.debugger;

/**
 * Thrown when an operation references a debug session that does not exist.
 */
public class SessionNotFoundException extends DebuggerException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
