package com.bosdb.debugger.protocol;

import com.bosdb.debugger.execution.ExecutionPoint;

import java.time.Instant;

public record ExecutionPointView(
    String id,
    Instant timestamp,
    String queryId,
    String stage,
    Integer lineNumber,
    String procedureId,
    String planNodeId
) {
    public static ExecutionPointView from(ExecutionPoint point) {
        if (point == null) {
            return null;
        }
        return new ExecutionPointView(point.id(), point.timestamp(), point.queryId(),
            point.stage() != null ? point.stage().name().toLowerCase() : null,
            point.lineNumber(), point.procedureId(), point.planNodeId());
    }
}
