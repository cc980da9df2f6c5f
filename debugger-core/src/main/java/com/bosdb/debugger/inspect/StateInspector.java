package com.bosdb.debugger.inspect;

import com.bosdb.debugger.execution.ExecutionContext;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exposes variables, transactions and locks while statements execute.
 * Variables live in named scopes keyed by {@code sessionId:scopeName}; transactions are global.
 */
public class StateInspector {

    public static final String SESSION_SCOPE = "session";
    public static final String PROCEDURE_SCOPE_PREFIX = "procedure:";

    private final Map<String, TransactionState> transactionStates = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Variable>> variableScopes = new ConcurrentHashMap<>();

    private static String scopeKey(String sessionId, String scopeName) {
        return sessionId + ":" + scopeName;
    }

    // ==================== Variables ====================

    /**
     * Get the variables of a scope in the order they were first set.
     */
    public List<Variable> getVariables(String sessionId, String scopeName) {
        Map<String, Variable> scope = variableScopes.get(scopeKey(sessionId, scopeName));
        if (scope == null) {
            return List.of();
        }
        synchronized (scope) {
            return new ArrayList<>(scope.values());
        }
    }

    /**
     * Set a variable. A later write with the same name replaces the earlier one.
     */
    public void setVariable(String sessionId, String scopeName, Variable variable) {
        Map<String, Variable> scope = variableScopes.computeIfAbsent(
            scopeKey(sessionId, scopeName), k -> Collections.synchronizedMap(new LinkedHashMap<>()));
        scope.put(variable.name(), variable);
    }

    public List<Variable> getSessionVariables(String sessionId) {
        return getVariables(sessionId, SESSION_SCOPE);
    }

    public List<Variable> getProcedureVariables(String sessionId, String procedureId) {
        return getVariables(sessionId, PROCEDURE_SCOPE_PREFIX + procedureId);
    }

    /**
     * Session-scope variables as a name to value map, for expression evaluation.
     */
    public Map<String, Object> getSessionVariableValues(String sessionId) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Variable v : getSessionVariables(sessionId)) {
            values.put(v.name(), v.value());
        }
        return values;
    }

    // ==================== Transactions ====================

    public TransactionState getTransactionState(String txnId) {
        return transactionStates.get(txnId);
    }

    public void setTransactionState(TransactionState state) {
        transactionStates.put(state.txnId(), state);
    }

    public boolean clearTransactionState(String txnId) {
        return transactionStates.remove(txnId) != null;
    }

    /**
     * Active transactions, oldest first.
     */
    public List<TransactionState> getActiveTransactions() {
        List<TransactionState> active = new ArrayList<>();
        for (TransactionState txn : transactionStates.values()) {
            if (txn.status() == TransactionStatus.ACTIVE) {
                active.add(txn);
            }
        }
        active.sort(Comparator.comparing(TransactionState::startTime, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(TransactionState::txnId));
        return active;
    }

    public TransactionLocks getTransactionLocks(String txnId) {
        TransactionState txn = transactionStates.get(txnId);
        if (txn == null) {
            return TransactionLocks.none();
        }
        return new TransactionLocks(txn.locksHeld(), txn.locksWaiting());
    }

    public boolean isTransactionBlocked(String txnId) {
        TransactionState txn = transactionStates.get(txnId);
        return txn != null && !txn.locksWaiting().isEmpty();
    }

    /**
     * Who blocks this transaction (from its waiting locks) and whom it blocks (from its held locks).
     */
    public BlockingTree getBlockingTree(String txnId) {
        TransactionState txn = transactionStates.get(txnId);
        if (txn == null) {
            return BlockingTree.empty();
        }

        Set<String> blockedBy = new LinkedHashSet<>();
        Set<String> blocked = new LinkedHashSet<>();
        for (Lock lock : txn.locksWaiting()) {
            blockedBy.addAll(lock.blockedBy());
        }
        for (Lock lock : txn.locksHeld()) {
            blocked.addAll(lock.blocking());
        }
        return new BlockingTree(new ArrayList<>(blocked), new ArrayList<>(blockedBy));
    }

    /**
     * Find cycles in the wait-for graph of active transactions.
     */
    public DeadlockReport detectDeadlocks() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        for (TransactionState txn : getActiveTransactions()) {
            List<String> blockedBy = getBlockingTree(txn.txnId()).blockedBy();
            if (!blockedBy.isEmpty()) {
                graph.put(txn.txnId(), blockedBy);
            }
        }

        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> recStack = new HashSet<>();
        for (String txnId : graph.keySet()) {
            if (!visited.contains(txnId)) {
                findCycles(txnId, new ArrayList<>(), graph, visited, recStack, cycles);
            }
        }
        return new DeadlockReport(cycles, cycles.size());
    }

    private void findCycles(String node, List<String> path, Map<String, List<String>> graph,
                            Set<String> visited, Set<String> recStack, List<List<String>> cycles) {
        visited.add(node);
        recStack.add(node);
        path.add(node);

        for (String neighbor : graph.getOrDefault(node, List.of())) {
            if (!visited.contains(neighbor)) {
                // each branch gets its own copy of the path
                findCycles(neighbor, new ArrayList<>(path), graph, visited, recStack, cycles);
            } else if (recStack.contains(neighbor)) {
                cycles.add(new ArrayList<>(path.subList(path.indexOf(neighbor), path.size())));
            }
        }

        recStack.remove(node);
    }

    // ==================== Context ====================

    /**
     * Capture the variables of a statement context and its transaction, if any.
     */
    public ContextState captureContextState(ExecutionContext context) {
        List<Variable> variables = new ArrayList<>();
        for (Map.Entry<String, Object> entry : context.variables().entrySet()) {
            variables.add(Variable.of(entry.getKey(), entry.getValue(), VariableScope.LOCAL));
        }
        TransactionState transaction = context.transactionId() != null
            ? transactionStates.get(context.transactionId())
            : null;
        return new ContextState(variables, transaction);
    }

    public InspectorStatistics getStatistics() {
        List<TransactionState> active = getActiveTransactions();
        int blocked = 0;
        int locks = 0;
        for (TransactionState txn : active) {
            if (!txn.locksWaiting().isEmpty()) {
                blocked++;
            }
            locks += txn.locksHeld().size() + txn.locksWaiting().size();
        }
        return new InspectorStatistics(active.size(), blocked, locks, detectDeadlocks().count());
    }

    /**
     * Drop every variable scope of a session.
     */
    public void clearSessionState(String sessionId) {
        String prefix = sessionId + ":";
        variableScopes.keySet().removeIf(key -> key.startsWith(prefix));
    }
}
