package com.bosdb.debugger.execution;

import java.util.List;

/**
 * Executes one SQL statement against a real database.
 * Any exception is propagated unchanged to the caller of the debug engine.
 */
@FunctionalInterface
public interface StatementRunner {

    QueryResult run(String sql, List<Object> parameters) throws Exception;
}
