package com.bosdb.debugger.protocol;

import com.bosdb.debugger.session.SessionState;

import java.util.List;

public record SessionStateView(
    String status,
    List<String> activeBreakpoints,
    ExecutionPointView currentExecutionPoint
) {
    public static SessionStateView from(SessionState state) {
        return new SessionStateView(state.status().wireName(), state.activeBreakpoints(),
            ExecutionPointView.from(state.currentExecutionPoint()));
    }
}
