package com.bosdb.debugger.protocol;

import com.bosdb.debugger.breakpoint.BreakpointSpec;
import com.bosdb.debugger.breakpoint.BreakpointTarget;
import com.bosdb.debugger.breakpoint.BreakpointType;
import com.bosdb.debugger.execution.QueryStage;

/**
 * A breakpoint as described by a client: the type plus whichever target fields
 * that type uses.
 */
public record BreakpointRequest(
    String type,
    Boolean enabled,
    String condition,
    String logMessage,
    String stage,
    String queryPattern,
    String procedureId,
    Integer lineNumber,
    String expression,
    String changeType,
    String event,
    String isolationLevel,
    String lockType,
    String nodeType
) {
    public static BreakpointRequest query(String queryPattern) {
        return new BreakpointRequest("query", null, null, null, null, queryPattern,
            null, null, null, null, null, null, null, null);
    }

    public static BreakpointRequest line(String procedureId, int lineNumber) {
        return new BreakpointRequest("line", null, null, null, null, null,
            procedureId, lineNumber, null, null, null, null, null, null);
    }

    /**
     * @throws IllegalArgumentException if the type is missing or unknown, or a
     *         required target field is absent
     */
    public BreakpointSpec toSpec() {
        BreakpointSpec spec = BreakpointSpec.of(toTarget());
        if (enabled != null) {
            spec = spec.withEnabled(enabled);
        }
        return spec.withCondition(condition).withLogMessage(logMessage);
    }

    private BreakpointTarget toTarget() {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Breakpoint type is required");
        }
        BreakpointType parsed;
        try {
            parsed = BreakpointType.valueOf(type.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown breakpoint type: " + type, e);
        }
        return switch (parsed) {
            case QUERY -> BreakpointTarget.query(parseStage(), queryPattern);
            case LINE -> {
                if (lineNumber == null) {
                    throw new IllegalArgumentException("Line breakpoint requires lineNumber");
                }
                yield BreakpointTarget.line(procedureId, lineNumber);
            }
            case DATA -> BreakpointTarget.data(expression, changeType);
            case TRANSACTION -> BreakpointTarget.transaction(event, isolationLevel);
            case LOCK -> BreakpointTarget.lock(event, lockType);
            case PLAN -> BreakpointTarget.plan(nodeType);
        };
    }

    private QueryStage parseStage() {
        if (stage == null || stage.isBlank()) {
            return null;
        }
        try {
            return QueryStage.fromName(stage);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown query stage: " + stage, e);
        }
    }
}
