package com.bosdb.debugger.session;

import java.time.Instant;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * A debug session owned by one user and bound to one database connection.
 * Identity and configuration never change; state and metadata are replaced as a whole.
 */
public class DebugSession {

    private final String id;
    private final String userId;
    private final String connectionId;
    private final Instant createdAt;
    private final SessionConfig config;

    private volatile SessionState state = SessionState.initial();
    private volatile SessionMetadata metadata = SessionMetadata.initial();

    DebugSession(String userId, String connectionId, SessionConfig config, Instant createdAt) {
        this.id = UUID.randomUUID().toString();
        this.userId = userId;
        this.connectionId = connectionId;
        this.config = config;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public SessionConfig getConfig() {
        return config;
    }

    public SessionState getState() {
        return state;
    }

    public SessionMetadata getMetadata() {
        return metadata;
    }

    synchronized SessionState updateState(UnaryOperator<SessionState> update) {
        state = update.apply(state);
        return state;
    }

    synchronized SessionMetadata updateMetadata(UnaryOperator<SessionMetadata> update) {
        metadata = update.apply(metadata);
        return metadata;
    }

    @Override
    public String toString() {
        return "DebugSession[" + id + ", user=" + userId + ", connection=" + connectionId
            + ", status=" + state.status() + "]";
    }
}
