package com.bosdb.debugger;

import com.bosdb.debugger.breakpoint.Breakpoint;
import com.bosdb.debugger.breakpoint.BreakpointManager;
import com.bosdb.debugger.breakpoint.BreakpointSpec;
import com.bosdb.debugger.eval.ExpressionEvaluator;
import com.bosdb.debugger.event.DebugEventListener;
import com.bosdb.debugger.event.DebugEventPublisher;
import com.bosdb.debugger.execution.ExecutionController;
import com.bosdb.debugger.execution.ExecutionPoint;
import com.bosdb.debugger.execution.QueryExecution;
import com.bosdb.debugger.execution.QueryResult;
import com.bosdb.debugger.execution.StatementRunner;
import com.bosdb.debugger.execution.StatementRunnerFactory;
import com.bosdb.debugger.inspect.BlockingTree;
import com.bosdb.debugger.inspect.DeadlockReport;
import com.bosdb.debugger.inspect.StateInspector;
import com.bosdb.debugger.inspect.TransactionState;
import com.bosdb.debugger.inspect.Variable;
import com.bosdb.debugger.session.DebugSession;
import com.bosdb.debugger.session.SessionConfig;
import com.bosdb.debugger.session.SessionManager;
import com.bosdb.debugger.timetravel.DataChange;
import com.bosdb.debugger.timetravel.TimeTravelEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the SQL debugger. Owns one instance of each component, forwards their
 * events to its own listeners and keeps cross-component state (breakpoint ids on the
 * session, cascading deletes) consistent.
 */
public class DebugEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DebugEngine.class);

    private final SessionManager sessionManager;
    private final BreakpointManager breakpointManager;
    private final ExecutionController executionController;
    private final StateInspector stateInspector;
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();
    private final TimeTravelEngine timeTravel = new TimeTravelEngine();
    private final StatementRunnerFactory runnerFactory;

    private final DebugEventPublisher events = new DebugEventPublisher();
    private final ExecutorService executor;

    public DebugEngine(StatementRunnerFactory runnerFactory) {
        this(runnerFactory, SessionManager.DEFAULT_MAX_SESSIONS_PER_USER);
    }

    public DebugEngine(StatementRunnerFactory runnerFactory, int maxSessionsPerUser) {
        this.runnerFactory = runnerFactory;
        this.sessionManager = new SessionManager(maxSessionsPerUser);
        this.breakpointManager = new BreakpointManager();
        this.stateInspector = new StateInspector();
        this.executionController = new ExecutionController(
            sessionManager, breakpointManager, stateInspector::getSessionVariableValues);

        sessionManager.addListener(events::publish);
        breakpointManager.addListener(events::publish);
        executionController.addListener(events::publish);

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "debug-query-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // Listener management

    public void addListener(DebugEventListener listener) {
        events.addListener(listener);
    }

    public void removeListener(DebugEventListener listener) {
        events.removeListener(listener);
    }

    // ==================== Sessions ====================

    public DebugSession createSession(String userId, String connectionId, SessionConfig.Overrides config) {
        return sessionManager.createSession(userId, connectionId, config);
    }

    public DebugSession getSession(String sessionId) {
        return sessionManager.getSession(sessionId);
    }

    public List<DebugSession> getUserSessions(String userId) {
        return sessionManager.getUserSessions(userId);
    }

    /**
     * Delete a session with its breakpoints, execution history and variables.
     * A query paused in the session fails with {@link ExecutionCancelledException}.
     */
    public boolean deleteSession(String sessionId) {
        if (sessionManager.getSession(sessionId) == null) {
            return false;
        }
        executionController.clearHistory(sessionId);
        breakpointManager.clearSessionBreakpoints(sessionId);
        stateInspector.clearSessionState(sessionId);
        return sessionManager.deleteSession(sessionId);
    }

    /**
     * Stop a session. A paused query is released and cancelled.
     */
    public boolean stopSession(String sessionId) {
        executionController.stop(sessionId);
        return sessionManager.stopSession(sessionId);
    }

    /**
     * Delete stopped sessions older than {@code maxAge}, cascading like {@link #deleteSession}.
     */
    public int cleanupInactiveSessions(Duration maxAge) {
        int deleted = 0;
        for (DebugSession session : sessionManager.getInactiveSessions(maxAge)) {
            if (deleteSession(session.getId())) {
                deleted++;
            }
        }
        if (deleted > 0) {
            log.info("[DebugEngine] Cleaned up {} inactive session(s)", deleted);
        }
        return deleted;
    }

    // ==================== Execution ====================

    /**
     * Execute a script on the session's own connection.
     * @throws SessionNotFoundException if the session does not exist
     */
    public QueryResult executeQuery(String sessionId, String query, List<Object> parameters) throws Exception {
        DebugSession session = sessionManager.getSession(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return executeQuery(sessionId, query, parameters, runnerFactory.forConnection(session.getConnectionId()));
    }

    public QueryResult executeQuery(String sessionId, String query, List<Object> parameters,
                                    StatementRunner runner) throws Exception {
        return executionController.executeQuery(sessionId, query, parameters, runner);
    }

    /**
     * Execute on an engine thread so the caller stays free to resume or step the session.
     * The future fails with the runner's exception wrapped in a {@link CompletionException}.
     */
    public CompletableFuture<QueryResult> executeQueryAsync(String sessionId, String query, List<Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return executeQuery(sessionId, query, parameters);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    /**
     * Pause the session's running query before its next statement.
     * @return false if nothing is executing
     */
    public boolean pause(String sessionId) {
        return executionController.requestPause(sessionId);
    }

    public void resume(String sessionId) {
        executionController.resume(sessionId);
    }

    public void stepOver(String sessionId) {
        executionController.stepOver(sessionId);
    }

    public void stepInto(String sessionId) {
        executionController.stepInto(sessionId);
    }

    public void stepOut(String sessionId) {
        executionController.stepOut(sessionId);
    }

    public ExecutionPoint rewind(String sessionId) {
        return executionController.rewind(sessionId);
    }

    public List<ExecutionPoint> getExecutionHistory(String sessionId) {
        return executionController.getExecutionHistory(sessionId);
    }

    public ExecutionPoint getCurrentExecutionPoint(String sessionId) {
        return executionController.getCurrentExecutionPoint(sessionId);
    }

    public List<QueryExecution> getActiveQueries() {
        return executionController.getActiveQueries();
    }

    // ==================== Breakpoints ====================

    /**
     * @throws SessionNotFoundException if the session does not exist
     * @throws IllegalArgumentException if the breakpoint is malformed
     */
    public Breakpoint setBreakpoint(String sessionId, BreakpointSpec spec) {
        if (sessionManager.getSession(sessionId) == null) {
            throw new SessionNotFoundException(sessionId);
        }
        Breakpoint bp = breakpointManager.createBreakpoint(sessionId, spec);
        syncActiveBreakpoints(sessionId);
        return bp;
    }

    public boolean removeBreakpoint(String breakpointId) {
        Breakpoint bp = breakpointManager.getBreakpoint(breakpointId);
        if (bp == null || !breakpointManager.removeBreakpoint(breakpointId)) {
            return false;
        }
        syncActiveBreakpoints(bp.sessionId());
        return true;
    }

    public boolean toggleBreakpoint(String breakpointId, boolean enabled) {
        if (!breakpointManager.setBreakpointEnabled(breakpointId, enabled)) {
            return false;
        }
        syncActiveBreakpoints(breakpointManager.getBreakpoint(breakpointId).sessionId());
        return true;
    }

    public List<Breakpoint> getBreakpoints(String sessionId) {
        return breakpointManager.getBreakpointsForSession(sessionId);
    }

    private void syncActiveBreakpoints(String sessionId) {
        List<String> active = new ArrayList<>();
        for (Breakpoint bp : breakpointManager.getBreakpointsForSession(sessionId)) {
            if (bp.enabled()) {
                active.add(bp.id());
            }
        }
        sessionManager.updateSessionState(sessionId, s -> s.withActiveBreakpoints(active));
    }

    // ==================== Inspection ====================

    public List<Variable> getVariables(String sessionId, String scopeName) {
        return stateInspector.getVariables(sessionId, scopeName);
    }

    public List<Variable> getSessionVariables(String sessionId) {
        return stateInspector.getSessionVariables(sessionId);
    }

    public void setVariable(String sessionId, String scopeName, Variable variable) {
        stateInspector.setVariable(sessionId, scopeName, variable);
    }

    public TransactionState getTransactionState(String txnId) {
        return stateInspector.getTransactionState(txnId);
    }

    public void setTransactionState(TransactionState state) {
        stateInspector.setTransactionState(state);
    }

    public List<TransactionState> getActiveTransactions() {
        return stateInspector.getActiveTransactions();
    }

    public BlockingTree getBlockingTree(String txnId) {
        return stateInspector.getBlockingTree(txnId);
    }

    public DeadlockReport detectDeadlocks() {
        return stateInspector.detectDeadlocks();
    }

    /**
     * Evaluate an expression against the session's variables and, when paused,
     * the current execution point ({@code lineNumber}, {@code queryId}).
     * @throws SessionNotFoundException if the session does not exist
     */
    public ExpressionEvaluator.EvalResult evaluate(String sessionId, String expression) {
        DebugSession session = sessionManager.getSession(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        Map<String, Object> variables = new LinkedHashMap<>(stateInspector.getSessionVariableValues(sessionId));
        ExecutionPoint point = session.getState().currentExecutionPoint();
        if (point != null) {
            variables.put("lineNumber", point.lineNumber());
            variables.put("queryId", point.queryId());
        }
        return evaluator.evaluate(expression, ExpressionEvaluator.EvaluationContext.of(variables));
    }

    // ==================== Statistics ====================

    public EngineStatistics getStatistics() {
        return new EngineStatistics(sessionManager.getStatistics(), stateInspector.getStatistics());
    }

    public SessionDebugStatistics getSessionStatistics(String sessionId) {
        return new SessionDebugStatistics(
            breakpointManager.getStatistics(sessionId),
            executionController.getExecutionHistory(sessionId).size());
    }

    // ==================== Time travel ====================

    public String generateInverseStatement(DataChange change) {
        return timeTravel.generateInverseSql(change);
    }

    // ==================== Lifecycle ====================

    /**
     * Cancel waiting executions and stop the async executor.
     */
    @Override
    public void close() {
        executionController.cancelAll();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[DebugEngine] Closed");
    }
}
