package com.bosdb.debugger.execution;

import com.bosdb.debugger.ExecutionCancelledException;
import com.bosdb.debugger.SessionNotFoundException;
import com.bosdb.debugger.breakpoint.BreakpointManager;
import com.bosdb.debugger.breakpoint.BreakpointSpec;
import com.bosdb.debugger.breakpoint.BreakpointTarget;
import com.bosdb.debugger.event.DebugEvent;
import com.bosdb.debugger.session.DebugSession;
import com.bosdb.debugger.session.SessionConfig;
import com.bosdb.debugger.session.SessionManager;
import com.bosdb.debugger.session.SessionStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionControllerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private SessionManager sessions;
    private BreakpointManager breakpoints;
    private ExecutionController controller;
    private DebugSession session;

    private List<String> executed;
    private List<DebugEvent> events;
    private BlockingQueue<DebugEvent.Paused> pauses;
    private ExecutorService pool;

    /** Returns one row per statement echoing the SQL. */
    private StatementRunner echoRunner;

    @BeforeEach
    void setUp() {
        sessions = new SessionManager();
        breakpoints = new BreakpointManager();
        controller = new ExecutionController(sessions, breakpoints, id -> Map.of("threshold", 2));
        session = sessions.createSession("alice", "conn", null);

        executed = new CopyOnWriteArrayList<>();
        events = new CopyOnWriteArrayList<>();
        pauses = new LinkedBlockingQueue<>();
        controller.addListener(events::add);
        controller.addListener(e -> {
            if (e instanceof DebugEvent.Paused p) {
                pauses.add(p);
            }
        });
        pool = Executors.newSingleThreadExecutor();

        echoRunner = (sql, params) -> {
            executed.add(sql);
            return new QueryResult(List.of(Map.of("sql", sql)), 1, List.of(new Field("sql", "text", false)));
        };
    }

    @AfterEach
    void tearDown() {
        controller.cancelAll();
        pool.shutdownNow();
    }

    private Future<QueryResult> executeAsync(String query) {
        return pool.submit(() -> controller.executeQuery(session.getId(), query, List.of(), echoRunner));
    }

    private DebugEvent.Paused awaitPause() throws InterruptedException {
        DebugEvent.Paused paused = pauses.poll(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        assertNotNull(paused, "execution did not pause in time");
        return paused;
    }

    @Test
    void executeQuery_aggregatesStatements() throws Exception {
        QueryResult result = controller.executeQuery(session.getId(), "SELECT 1; SELECT 2;", List.of(), echoRunner);

        assertEquals(List.of("SELECT 1", "SELECT 2"), executed);
        assertEquals(2, result.rowCount());
        assertEquals(2, result.rows().size());
        assertEquals("SELECT 2", result.rows().get(1).get("sql"));
        assertEquals(1, result.fields().size());
    }

    @Test
    void executeQuery_updatesMetadataAndEmitsLifecycle() throws Exception {
        controller.executeQuery(session.getId(), "SELECT 1", List.of(), echoRunner);

        assertEquals(1, session.getMetadata().totalQueries());
        assertInstanceOf(DebugEvent.QueryStarted.class, events.get(0));
        assertInstanceOf(DebugEvent.QueryStageReached.class, events.get(1));
        DebugEvent.QueryCompleted completed = (DebugEvent.QueryCompleted) events.get(2);
        assertEquals(QueryExecution.Status.COMPLETED, completed.execution().status());
        assertNotNull(completed.execution().duration());
        assertTrue(controller.getActiveQueries().isEmpty());
    }

    @Test
    void executeQuery_unknownSessionFails() {
        assertThrows(SessionNotFoundException.class,
            () -> controller.executeQuery("missing", "SELECT 1", List.of(), echoRunner));
    }

    @Test
    void executeQuery_rethrowsRunnerFailureUnchanged() {
        SQLException failure = new SQLException("relation \"nope\" does not exist");
        StatementRunner failing = (sql, params) -> {
            throw failure;
        };

        SQLException thrown = assertThrows(SQLException.class,
            () -> controller.executeQuery(session.getId(), "SELECT * FROM nope", List.of(), failing));

        assertSame(failure, thrown);
        DebugEvent.QueryFailed failed = (DebugEvent.QueryFailed) events.get(events.size() - 1);
        assertEquals(QueryExecution.Status.FAILED, failed.execution().status());
        assertSame(failure, failed.error());
        assertTrue(controller.getActiveQueries().isEmpty());
        assertEquals(0, session.getMetadata().totalQueries());
    }

    @Test
    void history_isBoundedByMaxHistorySize() throws Exception {
        DebugSession small = sessions.createSession("alice", "conn",
            SessionConfig.Overrides.none().withMaxHistorySize(3));

        controller.executeQuery(small.getId(), "SELECT 1; SELECT 2; SELECT 3; SELECT 4; SELECT 5", List.of(), echoRunner);

        List<ExecutionPoint> history = controller.getExecutionHistory(small.getId());
        assertEquals(3, history.size());
        assertEquals(3, history.get(0).lineNumber());
        assertEquals(5, history.get(2).lineNumber());
    }

    @Test
    void breakpoint_pausesUntilResumed() throws Exception {
        breakpoints.createBreakpoint(session.getId(), BreakpointSpec.of(BreakpointTarget.query("SELECT 2")));

        assertTimeoutPreemptively(TIMEOUT, () -> {
            Future<QueryResult> future = executeAsync("SELECT 1; SELECT 2; SELECT 3");

            DebugEvent.Paused paused = awaitPause();
            assertEquals(PauseReason.BREAKPOINT, paused.reason());
            assertNotNull(paused.breakpoint());
            assertEquals(2, paused.point().lineNumber());
            assertEquals(List.of("SELECT 1"), executed, "paused before running the matching statement");
            assertEquals(SessionStatus.PAUSED, session.getState().status());
            assertEquals(paused.point(), session.getState().currentExecutionPoint());
            assertEquals(1, session.getState().callStack().size());
            assertEquals(1, session.getMetadata().breakpointHits());
            assertEquals(ExecutionMode.PAUSED, controller.getExecutionMode(session.getId()));
            assertFalse(future.isDone());

            controller.resume(session.getId());

            QueryResult result = future.get();
            assertEquals(3, result.rowCount());
            assertEquals(SessionStatus.RUNNING, session.getState().status());
            assertTrue(pauses.isEmpty(), "no further pauses after resume");
        });
    }

    @Test
    void stepOver_pausesBeforeNextStatement() throws Exception {
        breakpoints.createBreakpoint(session.getId(), BreakpointSpec.of(BreakpointTarget.line(null, 1)));

        assertTimeoutPreemptively(TIMEOUT, () -> {
            Future<QueryResult> future = executeAsync("SELECT 1; SELECT 2");

            assertEquals(1, awaitPause().point().lineNumber());
            controller.stepOver(session.getId());

            DebugEvent.Paused stepped = awaitPause();
            assertEquals(PauseReason.STEP, stepped.reason());
            assertEquals(2, stepped.point().lineNumber());
            assertNull(stepped.breakpoint());
            assertEquals(List.of("SELECT 1"), executed);

            controller.resume(session.getId());
            assertEquals(2, future.get().rowCount());
        });
        assertTrue(events.stream().anyMatch(e -> e instanceof DebugEvent.Stepped s && s.stepType() == StepType.OVER));
    }

    @Test
    void conditionalBreakpoint_seesSourceVariables() throws Exception {
        breakpoints.createBreakpoint(session.getId(),
            BreakpointSpec.of(BreakpointTarget.query("SELECT")).withCondition("lineNumber > threshold"));

        assertTimeoutPreemptively(TIMEOUT, () -> {
            Future<QueryResult> future = executeAsync("SELECT 1; SELECT 2; SELECT 3");

            assertEquals(3, awaitPause().point().lineNumber());
            controller.resume(session.getId());
            future.get();
        });
    }

    @Test
    void stop_releasesPausedExecution() throws Exception {
        breakpoints.createBreakpoint(session.getId(), BreakpointSpec.of(BreakpointTarget.query("SELECT 1")));

        assertTimeoutPreemptively(TIMEOUT, () -> {
            Future<QueryResult> future = executeAsync("SELECT 1; SELECT 2");
            awaitPause();

            controller.stop(session.getId());

            ExecutionException e = assertThrows(ExecutionException.class, future::get);
            assertInstanceOf(ExecutionCancelledException.class, e.getCause());
        });
        assertTrue(executed.isEmpty());
        assertEquals(ExecutionMode.STOPPED, controller.getExecutionMode(session.getId()));
        assertInstanceOf(DebugEvent.QueryFailed.class, events.get(events.size() - 1));
    }

    @Test
    void stop_doesNotAffectLaterExecutions() throws Exception {
        controller.stop(session.getId());
        controller.executeQuery(session.getId(), "SELECT 1", List.of(), echoRunner);

        assertEquals(List.of("SELECT 1"), executed);
    }

    @Test
    void clearHistory_cancelsWaiter() throws Exception {
        breakpoints.createBreakpoint(session.getId(), BreakpointSpec.of(BreakpointTarget.query("SELECT")));

        assertTimeoutPreemptively(TIMEOUT, () -> {
            Future<QueryResult> future = executeAsync("SELECT 1");
            awaitPause();

            controller.clearHistory(session.getId());

            ExecutionException e = assertThrows(ExecutionException.class, future::get);
            assertInstanceOf(ExecutionCancelledException.class, e.getCause());
        });
        assertTrue(controller.getExecutionHistory(session.getId()).isEmpty());
        assertNull(controller.getExecutionMode(session.getId()));
    }

    @Test
    void requestPause_pausesAtNextStatementBoundary() throws Exception {
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        StatementRunner slowFirst = (sql, params) -> {
            if (sql.equals("SELECT 1")) {
                firstStarted.countDown();
                release.await();
            }
            return echoRunner.run(sql, params);
        };

        assertFalse(controller.requestPause(session.getId()), "nothing is running yet");

        assertTimeoutPreemptively(TIMEOUT, () -> {
            Future<QueryResult> future = pool.submit(
                () -> controller.executeQuery(session.getId(), "SELECT 1; SELECT 2", List.of(), slowFirst));
            firstStarted.await();

            assertTrue(controller.requestPause(session.getId()));
            release.countDown();

            DebugEvent.Paused paused = awaitPause();
            assertEquals(PauseReason.PAUSE, paused.reason());
            assertEquals(2, paused.point().lineNumber());

            controller.resume(session.getId());
            assertEquals(2, future.get().rowCount());
        });
    }

    @Test
    void rewind_walksBackThenStops() throws Exception {
        controller.executeQuery(session.getId(), "SELECT 1; SELECT 2", List.of(), echoRunner);
        List<ExecutionPoint> history = controller.getExecutionHistory(session.getId());

        assertEquals(history.get(1), controller.rewind(session.getId()));
        assertEquals(ExecutionMode.PAUSED, controller.getExecutionMode(session.getId()));
        assertEquals(history.get(0), session.getState().currentExecutionPoint());

        assertEquals(history.get(0), controller.rewind(session.getId()));
        assertEquals(ExecutionMode.STOPPED, controller.getExecutionMode(session.getId()));

        assertNull(controller.rewind(session.getId()), "empty history is a no-op");
        assertEquals(2, events.stream().filter(e -> e instanceof DebugEvent.Rewound).count());
    }

    @Test
    void splitStatements_dropsEmptyParts() {
        assertEquals(List.of("SELECT 1", "SELECT 2"), ExecutionController.splitStatements(" SELECT 1 ;; SELECT 2; "));
        assertTrue(ExecutionController.splitStatements(" ; ").isEmpty());
    }
}
