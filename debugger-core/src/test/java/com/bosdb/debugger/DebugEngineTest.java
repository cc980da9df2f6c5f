package com.bosdb.debugger;

import com.bosdb.debugger.breakpoint.Breakpoint;
import com.bosdb.debugger.breakpoint.BreakpointSpec;
import com.bosdb.debugger.breakpoint.BreakpointTarget;
import com.bosdb.debugger.eval.ExpressionEvaluator;
import com.bosdb.debugger.eval.Value;
import com.bosdb.debugger.event.DebugEvent;
import com.bosdb.debugger.execution.QueryResult;
import com.bosdb.debugger.execution.StatementRunnerFactory;
import com.bosdb.debugger.inspect.Variable;
import com.bosdb.debugger.inspect.VariableScope;
import com.bosdb.debugger.session.DebugSession;
import com.bosdb.debugger.session.SessionStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DebugEngineTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private DebugEngine engine;
    private List<DebugEvent> events;
    private List<String> connectionsUsed;

    @BeforeEach
    void setUp() {
        connectionsUsed = new CopyOnWriteArrayList<>();
        StatementRunnerFactory factory = connectionId -> {
            connectionsUsed.add(connectionId);
            return (sql, params) -> new QueryResult(List.of(Map.of("sql", sql)), 1, List.of());
        };
        engine = new DebugEngine(factory, 2);
        events = new CopyOnWriteArrayList<>();
        engine.addListener(events::add);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void executeQuery_usesRunnerOfSessionConnection() throws Exception {
        DebugSession session = engine.createSession("alice", "warehouse", null);

        QueryResult result = engine.executeQuery(session.getId(), "SELECT 1; SELECT 2", List.of());

        assertEquals(2, result.rowCount());
        assertEquals(List.of("warehouse"), connectionsUsed);
    }

    @Test
    void executeQuery_unknownSession() {
        assertThrows(SessionNotFoundException.class, () -> engine.executeQuery("missing", "SELECT 1", List.of()));
        assertTrue(connectionsUsed.isEmpty());
    }

    @Test
    void quota_comesFromConstructor() {
        engine.createSession("alice", "a", null);
        engine.createSession("alice", "b", null);

        assertThrows(QuotaExceededException.class, () -> engine.createSession("alice", "c", null));
    }

    @Test
    void events_areForwardedFromEveryComponent() throws Exception {
        DebugSession session = engine.createSession("alice", "conn", null);
        engine.setBreakpoint(session.getId(), BreakpointSpec.of(BreakpointTarget.query("nothing matches")));
        engine.executeQuery(session.getId(), "SELECT 1", List.of());

        assertTrue(events.stream().anyMatch(e -> e instanceof DebugEvent.SessionCreated));
        assertTrue(events.stream().anyMatch(e -> e instanceof DebugEvent.BreakpointCreated));
        assertTrue(events.stream().anyMatch(e -> e instanceof DebugEvent.QueryCompleted));
        assertTrue(events.stream().allMatch(e -> e.sessionId().equals(session.getId())));
    }

    @Test
    void activeBreakpoints_trackEnabledBreakpoints() {
        DebugSession session = engine.createSession("alice", "conn", null);
        Breakpoint a = engine.setBreakpoint(session.getId(), BreakpointSpec.of(BreakpointTarget.query("a")));
        Breakpoint b = engine.setBreakpoint(session.getId(), BreakpointSpec.of(BreakpointTarget.query("b")));
        assertEquals(List.of(a.id(), b.id()), session.getState().activeBreakpoints());

        assertTrue(engine.toggleBreakpoint(a.id(), false));
        assertEquals(List.of(b.id()), session.getState().activeBreakpoints());

        assertTrue(engine.removeBreakpoint(b.id()));
        assertTrue(session.getState().activeBreakpoints().isEmpty());
        assertFalse(engine.removeBreakpoint(b.id()));
    }

    @Test
    void setBreakpoint_requiresSession() {
        assertThrows(SessionNotFoundException.class,
            () -> engine.setBreakpoint("missing", BreakpointSpec.of(BreakpointTarget.query("a"))));
    }

    @Test
    void deleteSession_cascades() throws Exception {
        DebugSession session = engine.createSession("alice", "conn", null);
        String id = session.getId();
        engine.setBreakpoint(id, BreakpointSpec.of(BreakpointTarget.query("nothing")));
        engine.setVariable(id, "session", Variable.of("x", 1, VariableScope.SESSION));
        engine.executeQuery(id, "SELECT 1", List.of());

        assertTrue(engine.deleteSession(id));

        assertNull(engine.getSession(id));
        assertTrue(engine.getBreakpoints(id).isEmpty());
        assertTrue(engine.getExecutionHistory(id).isEmpty());
        assertTrue(engine.getSessionVariables(id).isEmpty());
        assertFalse(engine.deleteSession(id));
    }

    @Test
    void asyncExecution_pausesAndResumes() throws Exception {
        DebugSession session = engine.createSession("alice", "conn", null);
        CountDownLatch paused = new CountDownLatch(1);
        engine.addListener(e -> {
            if (e instanceof DebugEvent.Paused) {
                paused.countDown();
            }
        });
        engine.setBreakpoint(session.getId(), BreakpointSpec.of(BreakpointTarget.line(null, 2)));

        assertTimeoutPreemptively(TIMEOUT, () -> {
            CompletableFuture<QueryResult> future = engine.executeQueryAsync(session.getId(), "SELECT 1; SELECT 2", List.of());
            assertTrue(paused.await(5, TimeUnit.SECONDS));
            assertEquals(SessionStatus.PAUSED, engine.getSession(session.getId()).getState().status());
            assertEquals(2, engine.getCurrentExecutionPoint(session.getId()).lineNumber());
            assertEquals(1, engine.getActiveQueries().size());

            engine.resume(session.getId());

            assertEquals(2, future.get().rowCount());
        });
        assertEquals(1, engine.getSessionStatistics(session.getId()).breakpoints().totalHits());
        assertEquals(2, engine.getSessionStatistics(session.getId()).executionPoints());
    }

    @Test
    void stopSession_cancelsPausedQuery() throws Exception {
        DebugSession session = engine.createSession("alice", "conn", null);
        CountDownLatch paused = new CountDownLatch(1);
        engine.addListener(e -> {
            if (e instanceof DebugEvent.Paused) {
                paused.countDown();
            }
        });
        engine.setBreakpoint(session.getId(), BreakpointSpec.of(BreakpointTarget.query("SELECT")));

        assertTimeoutPreemptively(TIMEOUT, () -> {
            CompletableFuture<QueryResult> future = engine.executeQueryAsync(session.getId(), "SELECT 1", List.of());
            assertTrue(paused.await(5, TimeUnit.SECONDS));

            assertTrue(engine.stopSession(session.getId()));

            ExecutionException e = assertThrows(ExecutionException.class, future::get);
            assertInstanceOf(ExecutionCancelledException.class, e.getCause());
        });
        assertEquals(SessionStatus.STOPPED, engine.getSession(session.getId()).getState().status());
    }

    @Test
    void cleanupInactiveSessions_cascadesForStoppedSessions() {
        DebugSession stopped = engine.createSession("alice", "a", null);
        DebugSession running = engine.createSession("alice", "b", null);
        engine.setBreakpoint(stopped.getId(), BreakpointSpec.of(BreakpointTarget.query("x")));
        engine.stopSession(stopped.getId());

        assertEquals(1, engine.cleanupInactiveSessions(Duration.ofSeconds(-1)));

        assertNull(engine.getSession(stopped.getId()));
        assertTrue(engine.getBreakpoints(stopped.getId()).isEmpty());
        assertNotNull(engine.getSession(running.getId()));
    }

    @Test
    void evaluate_seesSessionVariables() {
        DebugSession session = engine.createSession("alice", "conn", null);
        engine.setVariable(session.getId(), "session", Variable.of("limit", 10, VariableScope.SESSION));

        ExpressionEvaluator.EvalResult result = engine.evaluate(session.getId(), "limit * 2");

        assertEquals(new ExpressionEvaluator.EvalResult.Success(Value.of(20L)), result);
        assertFalse(engine.evaluate(session.getId(), "unknown + 1").isSuccess());
        assertThrows(SessionNotFoundException.class, () -> engine.evaluate("missing", "1"));
    }

    @Test
    void getStatistics_combinesSessionsAndState() {
        engine.createSession("alice", "a", null);

        EngineStatistics stats = engine.getStatistics();

        assertEquals(1, stats.sessions().totalSessions());
        assertEquals(0, stats.state().activeTransactions());
    }

    @Test
    void executeQuery_completesWhenConditionIsTooDeep() throws Exception {
        DebugSession session = engine.createSession("alice", "conn", null);
        engine.setBreakpoint(session.getId(), BreakpointSpec.of(BreakpointTarget.query("SELECT"))
            .withCondition("(".repeat(20000) + "1" + ")".repeat(20000)));

        QueryResult result = assertTimeoutPreemptively(TIMEOUT,
            () -> engine.executeQuery(session.getId(), "SELECT 1", List.of()));

        assertEquals(1, result.rowCount());
    }

    @Test
    void asyncFailure_surfacesRunnerException() {
        DebugEngine failing = new DebugEngine(connectionId -> (sql, params) -> {
            throw new java.sql.SQLException("boom");
        });
        try {
            DebugSession session = failing.createSession("alice", "conn", null);
            CompletionException e = assertThrows(CompletionException.class,
                () -> failing.executeQueryAsync(session.getId(), "SELECT 1", List.of()).join());
            assertInstanceOf(java.sql.SQLException.class, e.getCause());
        } finally {
            failing.close();
        }
    }
}
