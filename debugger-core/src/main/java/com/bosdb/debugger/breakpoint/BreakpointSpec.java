package com.bosdb.debugger.breakpoint;

/**
 * What a caller asks for when creating a breakpoint. The store assigns id, session and counters.
 */
public record BreakpointSpec(
    BreakpointTarget target,
    boolean enabled,
    String condition,       // null = unconditional
    String logMessage       // null = normal breakpoint, non-null = log point
) {
    public BreakpointSpec {
        if (target == null) {
            throw new IllegalArgumentException("Breakpoint target is required");
        }
    }

    public static BreakpointSpec of(BreakpointTarget target) {
        return new BreakpointSpec(target, true, null, null);
    }

    public BreakpointSpec withEnabled(boolean enabled) {
        return new BreakpointSpec(target, enabled, condition, logMessage);
    }

    public BreakpointSpec withCondition(String condition) {
        return new BreakpointSpec(target, enabled, condition, logMessage);
    }

    public BreakpointSpec withLogMessage(String logMessage) {
        return new BreakpointSpec(target, enabled, condition, logMessage);
    }
}
