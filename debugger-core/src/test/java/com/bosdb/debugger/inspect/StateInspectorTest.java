package com.bosdb.debugger.inspect;

import com.bosdb.debugger.execution.ExecutionContext;
import com.bosdb.debugger.execution.ExecutionPoint;
import com.bosdb.debugger.execution.QueryStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StateInspectorTest {

    private StateInspector inspector;

    @BeforeEach
    void setUp() {
        inspector = new StateInspector();
    }

    /** Active transaction waiting on {@code waitsOn}; started at {@code second} seconds past the epoch. */
    private static TransactionState waiting(String txnId, int second, String... waitsOn) {
        List<Lock> waitingLocks = waitsOn.length == 0
            ? List.of()
            : List.of(Lock.waiting("lock-" + txnId, txnId, Lock.LockType.ROW, Lock.LockMode.EXCLUSIVE,
                "table", "accounts", List.of(waitsOn)));
        return new TransactionState(txnId, Instant.ofEpochSecond(second), IsolationLevel.READ_COMMITTED,
            TransactionStatus.ACTIVE, List.of(), waitingLocks, List.of());
    }

    @Test
    void variables_lastWriteWinsAndKeepsOrder() {
        inspector.setVariable("s1", "session", Variable.of("a", 1, VariableScope.SESSION));
        inspector.setVariable("s1", "session", Variable.of("b", "x", VariableScope.SESSION));
        inspector.setVariable("s1", "session", Variable.of("a", 2, VariableScope.SESSION));

        List<Variable> vars = inspector.getSessionVariables("s1");

        assertEquals(2, vars.size());
        assertEquals("a", vars.get(0).name());
        assertEquals(2, vars.get(0).value());
        assertEquals("int", vars.get(0).type());
        assertEquals(Map.of("a", 2, "b", "x"), inspector.getSessionVariableValues("s1"));
    }

    @Test
    void variables_areScopedBySessionAndScope() {
        inspector.setVariable("s1", "procedure:p1", Variable.of("i", 0, VariableScope.LOCAL));

        assertEquals(1, inspector.getProcedureVariables("s1", "p1").size());
        assertTrue(inspector.getSessionVariables("s1").isEmpty());
        assertTrue(inspector.getProcedureVariables("s2", "p1").isEmpty());
    }

    @Test
    void clearSessionState_removesAllScopesOfSession() {
        inspector.setVariable("s1", "session", Variable.of("a", 1, VariableScope.SESSION));
        inspector.setVariable("s1", "procedure:p1", Variable.of("b", 1, VariableScope.LOCAL));
        inspector.setVariable("s10", "session", Variable.of("c", 1, VariableScope.SESSION));

        inspector.clearSessionState("s1");

        assertTrue(inspector.getSessionVariables("s1").isEmpty());
        assertTrue(inspector.getProcedureVariables("s1", "p1").isEmpty());
        assertEquals(1, inspector.getSessionVariables("s10").size(), "prefix match stops at the separator");
    }

    @Test
    void activeTransactions_excludeFinishedOnes() {
        inspector.setTransactionState(waiting("t1", 1));
        inspector.setTransactionState(waiting("t2", 2).withStatus(TransactionStatus.COMMITTED));

        List<TransactionState> active = inspector.getActiveTransactions();

        assertEquals(1, active.size());
        assertEquals("t1", active.get(0).txnId());
        assertTrue(inspector.clearTransactionState("t2"));
        assertNull(inspector.getTransactionState("t2"));
    }

    @Test
    void blockingTree_unionsLockRelations() {
        Lock heldA = Lock.held("h1", "t1", Lock.LockType.ROW, Lock.LockMode.EXCLUSIVE, "table", "a", List.of("t2", "t3"));
        Lock heldB = Lock.held("h2", "t1", Lock.LockType.TABLE, Lock.LockMode.SHARED, "table", "b", List.of("t3"));
        Lock wait = Lock.waiting("w1", "t1", Lock.LockType.ROW, Lock.LockMode.UPDATE, "table", "c", List.of("t4"));
        inspector.setTransactionState(TransactionState.active("t1", IsolationLevel.SERIALIZABLE,
            List.of(heldA, heldB), List.of(wait)));

        BlockingTree tree = inspector.getBlockingTree("t1");

        assertEquals(List.of("t2", "t3"), tree.blocked());
        assertEquals(List.of("t4"), tree.blockedBy());
        assertTrue(inspector.isTransactionBlocked("t1"));
        assertEquals(2, inspector.getTransactionLocks("t1").held().size());
        assertEquals(BlockingTree.empty(), inspector.getBlockingTree("unknown"));
        assertFalse(inspector.isTransactionBlocked("unknown"));
    }

    @Test
    void detectDeadlocks_findsThreeWayCycle() {
        inspector.setTransactionState(waiting("t1", 1, "t2"));
        inspector.setTransactionState(waiting("t2", 2, "t3"));
        inspector.setTransactionState(waiting("t3", 3, "t1"));

        DeadlockReport report = inspector.detectDeadlocks();

        assertEquals(1, report.count());
        assertEquals(List.of("t1", "t2", "t3"), report.cycles().get(0));
    }

    @Test
    void detectDeadlocks_reportsOnlyTheCyclePartOfThePath() {
        inspector.setTransactionState(waiting("t0", 0, "t1"));
        inspector.setTransactionState(waiting("t1", 1, "t2"));
        inspector.setTransactionState(waiting("t2", 2, "t1"));

        DeadlockReport report = inspector.detectDeadlocks();

        assertEquals(1, report.count());
        assertEquals(Set.of("t1", "t2"), new HashSet<>(report.cycles().get(0)));
        assertFalse(report.cycles().get(0).contains("t0"));
    }

    @Test
    void detectDeadlocks_noneWithoutCycle() {
        inspector.setTransactionState(waiting("t1", 1, "t2"));
        inspector.setTransactionState(waiting("t2", 2, "t3"));
        inspector.setTransactionState(waiting("t3", 3));

        DeadlockReport report = inspector.detectDeadlocks();

        assertEquals(0, report.count());
        assertFalse(report.hasDeadlock());
    }

    @Test
    void detectDeadlocks_ignoresInactiveTransactions() {
        inspector.setTransactionState(waiting("t1", 1, "t2"));
        inspector.setTransactionState(waiting("t2", 2, "t1").withStatus(TransactionStatus.ABORTED));

        assertEquals(0, inspector.detectDeadlocks().count());
    }

    @Test
    void captureContextState_includesVariablesAndTransaction() {
        inspector.setTransactionState(waiting("t1", 1));
        ExecutionContext context = new ExecutionContext("s1", "q1", "SELECT 1", List.of(), Instant.now(),
            "alice", "conn", ExecutionPoint.statement("q1", QueryStage.EXECUTE, 1),
            Map.of("lineNumber", 1), "t1");

        ContextState state = inspector.captureContextState(context);

        assertEquals(1, state.variables().size());
        assertEquals(VariableScope.LOCAL, state.variables().get(0).scope());
        assertEquals("t1", state.transaction().txnId());
    }

    @Test
    void getStatistics_countsLocksAndDeadlocks() {
        inspector.setTransactionState(waiting("t1", 1, "t2"));
        inspector.setTransactionState(waiting("t2", 2, "t1"));
        inspector.setTransactionState(waiting("t3", 3));

        InspectorStatistics stats = inspector.getStatistics();

        assertEquals(3, stats.activeTransactions());
        assertEquals(2, stats.blockedTransactions());
        assertEquals(2, stats.totalLocks());
        assertEquals(1, stats.detectedDeadlocks());
    }
}
