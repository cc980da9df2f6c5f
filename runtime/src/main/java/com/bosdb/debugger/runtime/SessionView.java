package com.bosdb.debugger.runtime;

import com.bosdb.debugger.protocol.SessionStateView;
import com.bosdb.debugger.session.DebugSession;
import com.bosdb.debugger.session.SessionConfig;
import com.bosdb.debugger.session.SessionMetadata;

import java.time.Instant;

/**
 * JSON form of a session returned by the HTTP API.
 */
record SessionView(
    String id,
    String userId,
    String connectionId,
    Instant createdAt,
    SessionConfig config,
    SessionStateView state,
    SessionMetadata metadata
) {
    static SessionView from(DebugSession session) {
        return new SessionView(session.getId(), session.getUserId(), session.getConnectionId(),
            session.getCreatedAt(), session.getConfig(), SessionStateView.from(session.getState()),
            session.getMetadata());
    }
}
