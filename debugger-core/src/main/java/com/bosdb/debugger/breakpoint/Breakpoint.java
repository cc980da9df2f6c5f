package com.bosdb.debugger.breakpoint;

import java.time.Instant;

/**
 * A breakpoint with optional condition, log message and hit tracking.
 * This is an immutable record - use the with* methods to create modified copies.
 */
public record Breakpoint(
    String id,
    String sessionId,
    BreakpointTarget target,
    boolean enabled,
    int hitCount,
    Instant lastHit,        // null = never hit
    String condition,       // null = unconditional, non-null = condition expression
    String logMessage       // null = normal breakpoint, non-null = log point (doesn't pause)
) {
    public BreakpointType type() {
        return target.type();
    }

    /**
     * Check if this is a log point (logs message without pausing).
     */
    public boolean isLogPoint() {
        return logMessage != null && !logMessage.isEmpty();
    }

    public boolean isConditional() {
        return condition != null && !condition.isBlank();
    }

    public Breakpoint withEnabled(boolean enabled) {
        return new Breakpoint(id, sessionId, target, enabled, hitCount, lastHit, condition, logMessage);
    }

    /**
     * Return a copy with one more hit recorded at {@code at}.
     */
    public Breakpoint withHit(Instant at) {
        return new Breakpoint(id, sessionId, target, enabled, hitCount + 1, at, condition, logMessage);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Breakpoint[").append(id).append(", ").append(target);
        if (!enabled) sb.append(", disabled");
        if (isConditional()) sb.append(", condition=").append(condition);
        if (isLogPoint()) sb.append(", logPoint=").append(logMessage);
        sb.append(", hits=").append(hitCount).append("]");
        return sb.toString();
    }
}
