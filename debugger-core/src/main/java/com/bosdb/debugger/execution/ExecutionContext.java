package com.bosdb.debugger.execution;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-statement context used to evaluate breakpoints. Discarded after the statement.
 */
public record ExecutionContext(
    String sessionId,
    String queryId,
    String query,
    List<Object> parameters,
    Instant startTime,
    String userId,
    String connectionId,
    ExecutionPoint executionPoint,
    Map<String, Object> variables,
    String transactionId    // null = no transaction attached
) {
    public ExecutionContext {
        // SQL parameters and variable values may be null
        parameters = parameters != null ? Collections.unmodifiableList(new ArrayList<>(parameters)) : List.of();
        variables = variables != null ? Collections.unmodifiableMap(new LinkedHashMap<>(variables)) : Map.of();
    }
}
