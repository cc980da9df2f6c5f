package com.bosdb.debugger.execution;

/**
 * Supplies a statement runner bound to a session's database connection.
 */
@FunctionalInterface
public interface StatementRunnerFactory {

    StatementRunner forConnection(String connectionId);
}
