package com.bosdb.debugger.execution;

import com.bosdb.debugger.ExecutionCancelledException;
import com.bosdb.debugger.SessionNotFoundException;
import com.bosdb.debugger.breakpoint.Breakpoint;
import com.bosdb.debugger.breakpoint.BreakpointManager;
import com.bosdb.debugger.event.DebugEvent;
import com.bosdb.debugger.event.DebugEventListener;
import com.bosdb.debugger.event.DebugEventPublisher;
import com.bosdb.debugger.session.DebugSession;
import com.bosdb.debugger.session.SessionManager;
import com.bosdb.debugger.session.SessionStatus;
import com.bosdb.debugger.session.StackFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Runs SQL one statement at a time and stops between statements for breakpoints and steps.
 * A paused execution blocks the thread that called {@link #executeQuery} on its session's
 * condition until the session is resumed, stepped, stopped or cleared.
 */
public class ExecutionController {

    private static final Logger log = LoggerFactory.getLogger(ExecutionController.class);

    private static final int FRAME_NAME_LIMIT = 80;

    /**
     * Why the controller decided to stop before a statement.
     */
    private record BreakResult(PauseReason reason, Breakpoint breakpoint) {
        static BreakResult noBreak() { return new BreakResult(null, null); }
        static BreakResult pause(Breakpoint bp) { return new BreakResult(PauseReason.BREAKPOINT, bp); }
        static BreakResult pauseNoBreakpoint(PauseReason reason) { return new BreakResult(reason, null); }

        boolean shouldPause() {
            return reason != null;
        }
    }

    /**
     * Per-session execution state. All fields are guarded by {@code lock}.
     */
    private static final class SessionExecution {
        final ReentrantLock lock = new ReentrantLock();
        final Condition modeChanged = lock.newCondition();
        final Deque<ExecutionPoint> history = new ArrayDeque<>();
        ExecutionMode mode;         // null until first used; treated as RUNNING
        boolean pauseRequested;
        long generation;            // bumped to cancel every execution started before
        int running;                // executeQuery calls in flight
    }

    private final SessionManager sessionManager;
    private final BreakpointManager breakpointManager;
    private final Function<String, Map<String, Object>> variableSource;
    private final DebugEventPublisher events = new DebugEventPublisher();

    private final Map<String, SessionExecution> executions = new ConcurrentHashMap<>();
    private final Map<String, QueryExecution> pendingExecutions = new ConcurrentHashMap<>();

    public ExecutionController(SessionManager sessionManager, BreakpointManager breakpointManager) {
        this(sessionManager, breakpointManager, sessionId -> Map.of());
    }

    /**
     * @param variableSource supplies the user variables visible to breakpoint conditions of a session
     */
    public ExecutionController(SessionManager sessionManager, BreakpointManager breakpointManager,
                               Function<String, Map<String, Object>> variableSource) {
        this.sessionManager = sessionManager;
        this.breakpointManager = breakpointManager;
        this.variableSource = variableSource;
    }

    public void addListener(DebugEventListener listener) {
        events.addListener(listener);
    }

    public void removeListener(DebugEventListener listener) {
        events.removeListener(listener);
    }

    private SessionExecution executionFor(String sessionId) {
        return executions.computeIfAbsent(sessionId, k -> new SessionExecution());
    }

    private DebugSession requireSession(String sessionId) {
        DebugSession session = sessionManager.getSession(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    // ==================== Execution ====================

    /**
     * Execute a script statement by statement, stopping for breakpoints and steps.
     * Blocks the calling thread while the session is paused.
     *
     * @throws SessionNotFoundException if the session does not exist
     * @throws ExecutionCancelledException if the session is stopped or cleared while this runs
     * @throws Exception whatever the runner throws, unchanged
     */
    public QueryResult executeQuery(String sessionId, String query, List<Object> parameters,
                                    StatementRunner runner) throws Exception {
        DebugSession session = requireSession(sessionId);
        SessionExecution exec = executionFor(sessionId);

        long generation;
        exec.lock.lock();
        try {
            generation = exec.generation;
            exec.running++;
        } finally {
            exec.lock.unlock();
        }

        String queryId = UUID.randomUUID().toString();
        QueryExecution execution = QueryExecution.start(queryId, sessionId, query, parameters);
        pendingExecutions.put(queryId, execution);
        events.publish(new DebugEvent.QueryStarted(execution));

        try {
            List<String> statements = splitStatements(query);
            QueryResult aggregate = QueryResult.empty();

            for (int i = 0; i < statements.size(); i++) {
                String statement = statements.get(i);
                int lineNumber = i + 1;

                ExecutionPoint point = ExecutionPoint.statement(queryId, QueryStage.EXECUTE, lineNumber);
                recordExecutionPoint(exec, point, session.getConfig().maxHistorySize());

                ExecutionContext context = new ExecutionContext(
                    sessionId,
                    queryId,
                    statement,
                    List.of(),
                    Instant.now(),
                    session.getUserId(),
                    session.getConnectionId(),
                    point,
                    buildVariables(sessionId, queryId, statement, lineNumber, statements.size()),
                    null
                );

                BreakResult result = checkBreak(exec, generation, context);
                if (result.shouldPause()) {
                    pause(sessionId, exec, generation, context, result);
                }

                aggregate = aggregate.merge(runner.run(statement, List.of()));

                events.publish(new DebugEvent.QueryStageReached(
                    sessionId, queryId, QueryStage.EXECUTE, lineNumber, Instant.now()));
            }

            QueryExecution completed = execution.completed(aggregate);
            sessionManager.updateSessionMetadata(sessionId, m -> m.withQueryCompleted(completed.duration()));
            log.debug("[Execution] Query {} completed in {} ms ({} rows)",
                queryId, completed.duration(), aggregate.rowCount());
            events.publish(new DebugEvent.QueryCompleted(completed));
            return aggregate;
        } catch (Exception e) {
            QueryExecution failed = execution.failed(e);
            if (e instanceof ExecutionCancelledException) {
                log.info("[Execution] Query {} cancelled", queryId);
            } else {
                log.debug("[Execution] Query {} failed: {}", queryId, e.getMessage());
            }
            events.publish(new DebugEvent.QueryFailed(failed, e));
            throw e;
        } finally {
            pendingExecutions.remove(queryId);
            exec.lock.lock();
            try {
                exec.running--;
            } finally {
                exec.lock.unlock();
            }
        }
    }

    /**
     * Split a script into statements on ';'. Semicolons inside literals or comments are not
     * recognised.
     */
    static List<String> splitStatements(String query) {
        List<String> statements = new ArrayList<>();
        if (query == null) {
            return statements;
        }
        for (String part : query.split(";")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                statements.add(trimmed);
            }
        }
        return statements;
    }

    private Map<String, Object> buildVariables(String sessionId, String queryId, String statement,
                                               int lineNumber, int statementCount) {
        Map<String, Object> variables = new LinkedHashMap<>();
        Map<String, Object> user = variableSource.apply(sessionId);
        if (user != null) {
            variables.putAll(user);
        }
        variables.put("statement", statement);
        variables.put("lineNumber", lineNumber);
        variables.put("statementCount", statementCount);
        variables.put("queryId", queryId);
        return variables;
    }

    private void recordExecutionPoint(SessionExecution exec, ExecutionPoint point, int maxHistorySize) {
        exec.lock.lock();
        try {
            exec.history.addLast(point);
            while (exec.history.size() > maxHistorySize) {
                exec.history.removeFirst();
            }
        } finally {
            exec.lock.unlock();
        }
    }

    /**
     * Check whether to stop before the statement in {@code context}.
     */
    private BreakResult checkBreak(SessionExecution exec, long generation, ExecutionContext context) {
        Breakpoint bp = breakpointManager.shouldBreak(context);

        exec.lock.lock();
        try {
            if (exec.generation != generation) {
                throw new ExecutionCancelledException(context.sessionId(), context.queryId());
            }
            if (bp != null) {
                exec.pauseRequested = false;
                return BreakResult.pause(bp);
            }
            if (exec.pauseRequested) {
                exec.pauseRequested = false;
                return BreakResult.pauseNoBreakpoint(PauseReason.PAUSE);
            }
            if (exec.mode == ExecutionMode.STEPPING) {
                return BreakResult.pauseNoBreakpoint(PauseReason.STEP);
            }
            return BreakResult.noBreak();
        } finally {
            exec.lock.unlock();
        }
    }

    /**
     * Pause before a statement and block until the session is resumed or stepped.
     */
    private void pause(String sessionId, SessionExecution exec, long generation,
                       ExecutionContext context, BreakResult result) {
        ExecutionPoint point = context.executionPoint();

        exec.lock.lock();
        try {
            exec.mode = ExecutionMode.PAUSED;
        } finally {
            exec.lock.unlock();
        }

        StackFrame frame = new StackFrame(0, frameName(context.query()), point.lineNumber(), point.procedureId());
        sessionManager.updateSessionState(sessionId, s -> s
            .withStatus(SessionStatus.PAUSED)
            .withCurrentExecutionPoint(point)
            .withCallStack(List.of(frame)));
        if (result.reason() == PauseReason.BREAKPOINT) {
            sessionManager.updateSessionMetadata(sessionId, m -> m.withBreakpointHit());
        }

        log.debug("[Execution] Session {} paused ({}) at line {}", sessionId, result.reason(), point.lineNumber());
        events.publish(new DebugEvent.Paused(sessionId, result.reason(), point, result.breakpoint(), context));

        // Block this thread until resumed
        exec.lock.lock();
        try {
            while (exec.mode != ExecutionMode.RUNNING && exec.mode != ExecutionMode.STEPPING) {
                if (exec.generation != generation) {
                    throw new ExecutionCancelledException(sessionId, context.queryId());
                }
                exec.modeChanged.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException(sessionId, context.queryId());
        } finally {
            exec.lock.unlock();
        }
    }

    private static String frameName(String statement) {
        String oneLine = statement.replaceAll("\\s+", " ");
        return oneLine.length() <= FRAME_NAME_LIMIT ? oneLine : oneLine.substring(0, FRAME_NAME_LIMIT - 3) + "...";
    }

    private void setMode(String sessionId, ExecutionMode mode) {
        SessionExecution exec = executionFor(sessionId);
        exec.lock.lock();
        try {
            exec.mode = mode;
            exec.modeChanged.signalAll();
        } finally {
            exec.lock.unlock();
        }
    }

    // ==================== Control ====================

    /**
     * Ask a running query to pause before its next statement.
     * @return false if no query of the session is executing
     */
    public boolean requestPause(String sessionId) {
        requireSession(sessionId);
        SessionExecution exec = executionFor(sessionId);
        exec.lock.lock();
        try {
            if (exec.running == 0) {
                return false;
            }
            exec.pauseRequested = true;
            return true;
        } finally {
            exec.lock.unlock();
        }
    }

    /**
     * Continue execution until the next breakpoint.
     */
    public void resume(String sessionId) {
        requireSession(sessionId);
        setMode(sessionId, ExecutionMode.RUNNING);
        sessionManager.resumeSession(sessionId);
        events.publish(new DebugEvent.Resumed(sessionId));
    }

    /**
     * Step over - run the current statement and pause before the next one.
     */
    public void stepOver(String sessionId) {
        step(sessionId, StepType.OVER);
    }

    /**
     * Step into. Statements have no nested frames, so this behaves like step over.
     */
    public void stepInto(String sessionId) {
        step(sessionId, StepType.INTO);
    }

    /**
     * Step out. Statements have no nested frames, so this behaves like step over.
     */
    public void stepOut(String sessionId) {
        step(sessionId, StepType.OUT);
    }

    private void step(String sessionId, StepType stepType) {
        requireSession(sessionId);
        setMode(sessionId, ExecutionMode.STEPPING);
        sessionManager.resumeSession(sessionId);
        events.publish(new DebugEvent.Stepped(sessionId, stepType));
    }

    /**
     * Move the session back one execution point. No SQL is undone.
     * If an earlier point remains it becomes current and the session is paused there;
     * otherwise execution is marked stopped.
     * @return the point that was removed, or null if the history was empty
     */
    public ExecutionPoint rewind(String sessionId) {
        requireSession(sessionId);
        SessionExecution exec = executionFor(sessionId);
        ExecutionPoint removed;
        ExecutionPoint previous;
        exec.lock.lock();
        try {
            removed = exec.history.pollLast();
            if (removed == null) {
                return null;
            }
            previous = exec.history.peekLast();
            exec.mode = previous != null ? ExecutionMode.PAUSED : ExecutionMode.STOPPED;
        } finally {
            exec.lock.unlock();
        }

        events.publish(new DebugEvent.Rewound(sessionId, removed));
        if (previous != null) {
            ExecutionPoint current = previous;
            sessionManager.updateSessionState(sessionId, s -> s.withCurrentExecutionPoint(current));
        }
        return removed;
    }

    /**
     * Stop the session's execution. A paused query is released and fails with
     * {@link ExecutionCancelledException}; a running one fails before its next statement.
     */
    public void stop(String sessionId) {
        SessionExecution exec = executions.get(sessionId);
        if (exec == null) {
            return;
        }
        exec.lock.lock();
        try {
            exec.mode = ExecutionMode.STOPPED;
            exec.generation++;
            exec.pauseRequested = false;
            exec.modeChanged.signalAll();
        } finally {
            exec.lock.unlock();
        }
    }

    // ==================== Accessors ====================

    public List<ExecutionPoint> getExecutionHistory(String sessionId) {
        SessionExecution exec = executions.get(sessionId);
        if (exec == null) {
            return List.of();
        }
        exec.lock.lock();
        try {
            return new ArrayList<>(exec.history);
        } finally {
            exec.lock.unlock();
        }
    }

    public ExecutionPoint getCurrentExecutionPoint(String sessionId) {
        DebugSession session = sessionManager.getSession(sessionId);
        return session != null ? session.getState().currentExecutionPoint() : null;
    }

    /**
     * Current mode, or null if the session has never executed or been controlled.
     */
    public ExecutionMode getExecutionMode(String sessionId) {
        SessionExecution exec = executions.get(sessionId);
        if (exec == null) {
            return null;
        }
        exec.lock.lock();
        try {
            return exec.mode;
        } finally {
            exec.lock.unlock();
        }
    }

    public List<QueryExecution> getActiveQueries() {
        return new ArrayList<>(pendingExecutions.values());
    }

    /**
     * Forget a session's history and mode. Waiting executions are cancelled.
     */
    public void clearHistory(String sessionId) {
        SessionExecution exec = executions.remove(sessionId);
        if (exec == null) {
            return;
        }
        exec.lock.lock();
        try {
            exec.history.clear();
            exec.mode = null;
            exec.generation++;
            exec.modeChanged.signalAll();
        } finally {
            exec.lock.unlock();
        }
    }

    /**
     * Cancel every waiting execution of every session.
     */
    public void cancelAll() {
        for (String sessionId : new ArrayList<>(executions.keySet())) {
            stop(sessionId);
        }
    }
}
