package com.bosdb.debugger.protocol;

import com.bosdb.debugger.session.DebugLevel;
import com.bosdb.debugger.session.SessionConfig;

/**
 * Partial session configuration as sent by clients. Absent fields keep their defaults.
 */
public record SessionConfigRequest(
    String database,
    String debugLevel,
    Boolean autoBreakOnError,
    Integer maxHistorySize,
    Boolean enableTimeTravel
) {
    /**
     * @throws IllegalArgumentException if the debug level is unknown
     */
    public SessionConfig.Overrides toOverrides() {
        DebugLevel level = null;
        if (debugLevel != null && !debugLevel.isBlank()) {
            try {
                level = DebugLevel.valueOf(debugLevel.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown debug level: " + debugLevel, e);
            }
        }
        return new SessionConfig.Overrides(database, level, autoBreakOnError, maxHistorySize, enableTimeTravel);
    }
}
