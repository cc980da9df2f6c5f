package com.bosdb.debugger.execution;

import java.time.Instant;
import java.util.UUID;

/**
 * A single recorded step of statement execution. Immutable.
 */
public record ExecutionPoint(
    String id,
    Instant timestamp,
    String queryId,
    QueryStage stage,
    Integer lineNumber,     // null = not tied to a line
    String procedureId,     // null = top-level script
    String planNodeId       // null = not tied to a plan node
) {
    /**
     * Create a point for a statement of a top-level script.
     */
    public static ExecutionPoint statement(String queryId, QueryStage stage, int lineNumber) {
        return new ExecutionPoint(UUID.randomUUID().toString(), Instant.now(), queryId, stage, lineNumber, null, null);
    }

    /**
     * Create a point for a line inside a stored procedure.
     */
    public static ExecutionPoint procedureLine(String queryId, String procedureId, int lineNumber) {
        return new ExecutionPoint(UUID.randomUUID().toString(), Instant.now(), queryId, QueryStage.EXECUTE,
            lineNumber, procedureId, null);
    }
}
