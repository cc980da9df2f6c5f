package com.bosdb.debugger.session;

import com.bosdb.debugger.QuotaExceededException;
import com.bosdb.debugger.event.DebugEvent;
import com.bosdb.debugger.event.DebugEventListener;
import com.bosdb.debugger.event.DebugEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Stores debug sessions and enforces the per-user session quota.
 * Creation and deletion are serialized on one index lock so the quota check and the
 * insert happen atomically; lookups and state updates do not take that lock.
 */
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    public static final int DEFAULT_MAX_SESSIONS_PER_USER = 5;

    private final int maxSessionsPerUser;
    private final Clock clock;

    private final Object indexLock = new Object();
    private final Map<String, DebugSession> sessions = new LinkedHashMap<>();
    private final Map<String, Set<String>> userSessions = new HashMap<>();

    private final DebugEventPublisher events = new DebugEventPublisher();

    public SessionManager() {
        this(DEFAULT_MAX_SESSIONS_PER_USER);
    }

    public SessionManager(int maxSessionsPerUser) {
        this(maxSessionsPerUser, Clock.systemUTC());
    }

    public SessionManager(int maxSessionsPerUser, Clock clock) {
        if (maxSessionsPerUser <= 0) {
            throw new IllegalArgumentException("maxSessionsPerUser must be positive: " + maxSessionsPerUser);
        }
        this.maxSessionsPerUser = maxSessionsPerUser;
        this.clock = clock;
    }

    public void addListener(DebugEventListener listener) {
        events.addListener(listener);
    }

    public void removeListener(DebugEventListener listener) {
        events.removeListener(listener);
    }

    public int getMaxSessionsPerUser() {
        return maxSessionsPerUser;
    }

    /**
     * Create a session for a user.
     * @throws QuotaExceededException if the user already owns the maximum number of sessions
     */
    public DebugSession createSession(String userId, String connectionId, SessionConfig.Overrides overrides) {
        SessionConfig config = SessionConfig.from(overrides);
        DebugSession session;
        synchronized (indexLock) {
            Set<String> owned = userSessions.get(userId);
            if (owned != null && owned.size() >= maxSessionsPerUser) {
                throw new QuotaExceededException(userId, maxSessionsPerUser);
            }
            session = new DebugSession(userId, connectionId, config, clock.instant());
            sessions.put(session.getId(), session);
            userSessions.computeIfAbsent(userId, k -> new LinkedHashSet<>()).add(session.getId());
        }
        log.info("[Sessions] Created session {} for user {} on connection {}", session.getId(), userId, connectionId);
        events.publish(new DebugEvent.SessionCreated(session));
        return session;
    }

    public DebugSession getSession(String sessionId) {
        synchronized (indexLock) {
            return sessions.get(sessionId);
        }
    }

    /**
     * Sessions owned by a user, in creation order.
     */
    public List<DebugSession> getUserSessions(String userId) {
        synchronized (indexLock) {
            Set<String> ids = userSessions.get(userId);
            if (ids == null) {
                return List.of();
            }
            List<DebugSession> result = new ArrayList<>(ids.size());
            for (String id : ids) {
                DebugSession s = sessions.get(id);
                if (s != null) {
                    result.add(s);
                }
            }
            return result;
        }
    }

    public List<DebugSession> getAllSessions() {
        synchronized (indexLock) {
            return new ArrayList<>(sessions.values());
        }
    }

    /**
     * Replace a session's state with the result of applying {@code update} to it.
     * @return false if the session does not exist
     */
    public boolean updateSessionState(String sessionId, UnaryOperator<SessionState> update) {
        DebugSession session = getSession(sessionId);
        if (session == null) {
            return false;
        }
        SessionState state = session.updateState(update);
        events.publish(new DebugEvent.SessionStateChanged(sessionId, state));
        return true;
    }

    /**
     * Replace a session's counters. Does not raise an event.
     */
    public boolean updateSessionMetadata(String sessionId, UnaryOperator<SessionMetadata> update) {
        DebugSession session = getSession(sessionId);
        if (session == null) {
            return false;
        }
        session.updateMetadata(update);
        return true;
    }

    public boolean pauseSession(String sessionId) {
        return updateSessionState(sessionId, s -> s.withStatus(SessionStatus.PAUSED));
    }

    public boolean resumeSession(String sessionId) {
        return updateSessionState(sessionId, s -> s.withStatus(SessionStatus.RUNNING));
    }

    public boolean stopSession(String sessionId) {
        return updateSessionState(sessionId, s -> s.withStatus(SessionStatus.STOPPED));
    }

    public boolean deleteSession(String sessionId) {
        DebugSession removed;
        synchronized (indexLock) {
            removed = sessions.remove(sessionId);
            if (removed == null) {
                return false;
            }
            Set<String> owned = userSessions.get(removed.getUserId());
            if (owned != null) {
                owned.remove(sessionId);
                if (owned.isEmpty()) {
                    userSessions.remove(removed.getUserId());
                }
            }
        }
        log.info("[Sessions] Deleted session {}", sessionId);
        events.publish(new DebugEvent.SessionDeleted(removed));
        return true;
    }

    /**
     * Stopped sessions created more than {@code maxAge} ago.
     */
    public List<DebugSession> getInactiveSessions(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        List<DebugSession> expired = new ArrayList<>();
        for (DebugSession session : getAllSessions()) {
            if (session.getState().status() == SessionStatus.STOPPED && session.getCreatedAt().isBefore(cutoff)) {
                expired.add(session);
            }
        }
        return expired;
    }

    /**
     * Delete stopped sessions created more than {@code maxAge} ago.
     * @return the number of sessions deleted
     */
    public int cleanupInactiveSessions(Duration maxAge) {
        int deleted = 0;
        for (DebugSession session : getInactiveSessions(maxAge)) {
            if (deleteSession(session.getId())) {
                deleted++;
            }
        }
        if (deleted > 0) {
            log.info("[Sessions] Cleaned up {} inactive session(s)", deleted);
        }
        return deleted;
    }

    public SessionStatistics getStatistics() {
        List<DebugSession> all = getAllSessions();
        Map<SessionStatus, Integer> byStatus = new EnumMap<>(SessionStatus.class);
        Map<String, Integer> byUser = new HashMap<>();
        long totalQueries = 0;
        long totalHits = 0;
        for (DebugSession session : all) {
            byStatus.merge(session.getState().status(), 1, Integer::sum);
            byUser.merge(session.getUserId(), 1, Integer::sum);
            SessionMetadata metadata = session.getMetadata();
            totalQueries += metadata.totalQueries();
            totalHits += metadata.breakpointHits();
        }
        return new SessionStatistics(all.size(), byStatus, byUser, totalQueries, totalHits);
    }
}
