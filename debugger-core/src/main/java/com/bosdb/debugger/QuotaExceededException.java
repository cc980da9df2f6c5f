package com.bosdb.debugger;

/**
 * Thrown when a user already holds the maximum number of debug sessions.
 */
public class QuotaExceededException extends DebuggerException {

    private final String userId;
    private final int limit;

    public QuotaExceededException(String userId, int limit) {
        super("User has reached maximum number of debug sessions (" + limit + ")");
        this.userId = userId;
        this.limit = limit;
    }

    public String getUserId() {
        return userId;
    }

    public int getLimit() {
        return limit;
    }
}
