package com.bosdb.debugger.session;

import com.bosdb.debugger.execution.ExecutionPoint;

import java.util.List;

/**
 * Runtime state of a session. Immutable - use the with* methods to create modified copies.
 */
public record SessionState(
    SessionStatus status,
    List<String> activeBreakpoints,
    List<StackFrame> callStack,
    ExecutionPoint currentExecutionPoint   // null until the first pause
) {
    public SessionState {
        activeBreakpoints = activeBreakpoints != null ? List.copyOf(activeBreakpoints) : List.of();
        callStack = callStack != null ? List.copyOf(callStack) : List.of();
    }

    public static SessionState initial() {
        return new SessionState(SessionStatus.RUNNING, List.of(), List.of(), null);
    }

    public SessionState withStatus(SessionStatus status) {
        return new SessionState(status, activeBreakpoints, callStack, currentExecutionPoint);
    }

    public SessionState withActiveBreakpoints(List<String> activeBreakpoints) {
        return new SessionState(status, activeBreakpoints, callStack, currentExecutionPoint);
    }

    public SessionState withCallStack(List<StackFrame> callStack) {
        return new SessionState(status, activeBreakpoints, callStack, currentExecutionPoint);
    }

    public SessionState withCurrentExecutionPoint(ExecutionPoint point) {
        return new SessionState(status, activeBreakpoints, callStack, point);
    }
}
