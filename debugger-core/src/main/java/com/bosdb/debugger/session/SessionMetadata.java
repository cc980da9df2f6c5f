package com.bosdb.debugger.session;

/**
 * Bookkeeping counters of a session.
 */
public record SessionMetadata(
    long totalQueries,
    long breakpointHits,
    long totalExecutionTime   // milliseconds
) {
    public static SessionMetadata initial() {
        return new SessionMetadata(0, 0, 0);
    }

    /**
     * Return a copy counting one more completed query.
     */
    public SessionMetadata withQueryCompleted(long durationMillis) {
        return new SessionMetadata(totalQueries + 1, breakpointHits, totalExecutionTime + durationMillis);
    }

    public SessionMetadata withBreakpointHit() {
        return new SessionMetadata(totalQueries, breakpointHits + 1, totalExecutionTime);
    }
}
