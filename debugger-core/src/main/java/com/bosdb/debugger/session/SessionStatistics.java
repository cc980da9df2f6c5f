package com.bosdb.debugger.session;

import java.util.Map;

/**
 * Aggregate counts over all sessions of a store.
 */
public record SessionStatistics(
    int totalSessions,
    Map<SessionStatus, Integer> byStatus,
    Map<String, Integer> byUser,
    long totalQueries,
    long totalBreakpointHits
) {
    public SessionStatistics {
        byStatus = Map.copyOf(byStatus);
        byUser = Map.copyOf(byUser);
    }
}
