package com.bosdb.debugger;

/**
 * Thrown out of a paused query execution when its session is stopped or deleted.
 */
public class ExecutionCancelledException extends DebuggerException {

    private final String sessionId;
    private final String queryId;

    public ExecutionCancelledException(String sessionId, String queryId) {
        super("Execution cancelled: session " + sessionId + ", query " + queryId);
        this.sessionId = sessionId;
        this.queryId = queryId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getQueryId() {
        return queryId;
    }
}
