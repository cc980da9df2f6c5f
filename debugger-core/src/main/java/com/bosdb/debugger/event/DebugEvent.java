package com.bosdb.debugger.event;

import com.bosdb.debugger.breakpoint.Breakpoint;
import com.bosdb.debugger.execution.ExecutionContext;
import com.bosdb.debugger.execution.ExecutionPoint;
import com.bosdb.debugger.execution.PauseReason;
import com.bosdb.debugger.execution.QueryExecution;
import com.bosdb.debugger.execution.QueryStage;
import com.bosdb.debugger.execution.StepType;
import com.bosdb.debugger.session.DebugSession;
import com.bosdb.debugger.session.SessionState;

import java.time.Instant;

/**
 * Everything the debugger components report to the outside world.
 * Every event belongs to exactly one session.
 */
public sealed interface DebugEvent {

    String sessionId();

    // Session store

    record SessionCreated(DebugSession session) implements DebugEvent {
        @Override
        public String sessionId() {
            return session.getId();
        }
    }

    record SessionStateChanged(String sessionId, SessionState state) implements DebugEvent {}

    record SessionDeleted(DebugSession session) implements DebugEvent {
        @Override
        public String sessionId() {
            return session.getId();
        }
    }

    // Breakpoint store

    record BreakpointCreated(Breakpoint breakpoint) implements DebugEvent {
        @Override
        public String sessionId() {
            return breakpoint.sessionId();
        }
    }

    record BreakpointRemoved(Breakpoint breakpoint) implements DebugEvent {
        @Override
        public String sessionId() {
            return breakpoint.sessionId();
        }
    }

    record BreakpointChanged(Breakpoint breakpoint) implements DebugEvent {
        @Override
        public String sessionId() {
            return breakpoint.sessionId();
        }
    }

    record BreakpointHit(Breakpoint breakpoint, ExecutionContext context) implements DebugEvent {
        @Override
        public String sessionId() {
            return breakpoint.sessionId();
        }
    }

    /**
     * A log point matched. Execution does not stop for log points.
     */
    record LogPointHit(Breakpoint breakpoint, ExecutionContext context, String message) implements DebugEvent {
        @Override
        public String sessionId() {
            return breakpoint.sessionId();
        }
    }

    record SessionBreakpointsCleared(String sessionId) implements DebugEvent {}

    // Execution controller

    record QueryStarted(QueryExecution execution) implements DebugEvent {
        @Override
        public String sessionId() {
            return execution.sessionId();
        }
    }

    record QueryStageReached(String sessionId, String queryId, QueryStage stage, int lineNumber,
                             Instant timestamp) implements DebugEvent {}

    record QueryCompleted(QueryExecution execution) implements DebugEvent {
        @Override
        public String sessionId() {
            return execution.sessionId();
        }
    }

    record QueryFailed(QueryExecution execution, Throwable error) implements DebugEvent {
        @Override
        public String sessionId() {
            return execution.sessionId();
        }
    }

    record Paused(
        String sessionId,
        PauseReason reason,
        ExecutionPoint point,
        Breakpoint breakpoint,      // null unless reason is BREAKPOINT
        ExecutionContext context
    ) implements DebugEvent {}

    record Resumed(String sessionId) implements DebugEvent {}

    record Stepped(String sessionId, StepType stepType) implements DebugEvent {}

    record Rewound(String sessionId, ExecutionPoint point) implements DebugEvent {}
}
