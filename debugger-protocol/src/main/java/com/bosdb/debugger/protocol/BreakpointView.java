package com.bosdb.debugger.protocol;

import com.bosdb.debugger.breakpoint.Breakpoint;
import com.bosdb.debugger.breakpoint.BreakpointTarget;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire form of a breakpoint. The target is flattened into plain fields; query
 * patterns are sent as their source text.
 */
public record BreakpointView(
    String id,
    String sessionId,
    String type,
    boolean enabled,
    int hitCount,
    Instant lastHit,
    String condition,
    String logMessage,
    Map<String, Object> target
) {
    public static BreakpointView from(Breakpoint bp) {
        if (bp == null) {
            return null;
        }
        return new BreakpointView(bp.id(), bp.sessionId(), bp.type().wireName(), bp.enabled(), bp.hitCount(),
            bp.lastHit(), bp.condition(), bp.logMessage(), describe(bp.target()));
    }

    static Map<String, Object> describe(BreakpointTarget target) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (target instanceof BreakpointTarget.Query q) {
            putIfPresent(fields, "stage", q.stage() != null ? q.stage().name().toLowerCase() : null);
            putIfPresent(fields, "queryPattern", q.queryPattern() != null ? q.queryPattern().pattern() : null);
        } else if (target instanceof BreakpointTarget.Line l) {
            putIfPresent(fields, "procedureId", l.procedureId());
            fields.put("lineNumber", l.lineNumber());
        } else if (target instanceof BreakpointTarget.Data d) {
            putIfPresent(fields, "expression", d.expression());
            putIfPresent(fields, "changeType", d.changeType());
        } else if (target instanceof BreakpointTarget.Transaction t) {
            putIfPresent(fields, "event", t.event());
            putIfPresent(fields, "isolationLevel", t.isolationLevel());
        } else if (target instanceof BreakpointTarget.Lock l) {
            putIfPresent(fields, "event", l.event());
            putIfPresent(fields, "lockType", l.lockType());
        } else if (target instanceof BreakpointTarget.Plan p) {
            putIfPresent(fields, "nodeType", p.nodeType());
        }
        return fields;
    }

    private static void putIfPresent(Map<String, Object> fields, String key, Object value) {
        if (value != null) {
            fields.put(key, value);
        }
    }
}
