package com.bosdb.debugger.breakpoint;

import com.bosdb.debugger.eval.ExpressionEvaluator;
import com.bosdb.debugger.event.DebugEvent;
import com.bosdb.debugger.event.DebugEventListener;
import com.bosdb.debugger.event.DebugEventPublisher;
import com.bosdb.debugger.execution.ExecutionContext;
import com.bosdb.debugger.execution.ExecutionPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Manages breakpoints per session and decides whether execution should stop.
 * Thread-safe: one lock guards both indices, and a hit is counted and reported
 * while that lock is held so hit counts and hit events never disagree.
 */
public class BreakpointManager {

    private static final Logger log = LoggerFactory.getLogger(BreakpointManager.class);

    private final Object lock = new Object();
    private final Map<String, Breakpoint> breakpoints = new LinkedHashMap<>();
    private final Map<String, Set<String>> sessionBreakpoints = new HashMap<>();

    private final ExpressionEvaluator evaluator;
    private final Clock clock;
    private final DebugEventPublisher events = new DebugEventPublisher();

    public BreakpointManager() {
        this(new ExpressionEvaluator(), Clock.systemUTC());
    }

    public BreakpointManager(ExpressionEvaluator evaluator, Clock clock) {
        this.evaluator = evaluator;
        this.clock = clock;
    }

    public void addListener(DebugEventListener listener) {
        events.addListener(listener);
    }

    public void removeListener(DebugEventListener listener) {
        events.removeListener(listener);
    }

    /**
     * Create a breakpoint with zero hits. Enabled state, condition and log message come from {@code spec}.
     */
    public Breakpoint createBreakpoint(String sessionId, BreakpointSpec spec) {
        Breakpoint bp = new Breakpoint(
            UUID.randomUUID().toString(),
            sessionId,
            spec.target(),
            spec.enabled(),
            0,
            null,
            spec.condition(),
            spec.logMessage()
        );
        synchronized (lock) {
            breakpoints.put(bp.id(), bp);
            sessionBreakpoints.computeIfAbsent(sessionId, k -> new LinkedHashSet<>()).add(bp.id());
        }
        log.debug("[Breakpoints] Created {}", bp);
        events.publish(new DebugEvent.BreakpointCreated(bp));
        return bp;
    }

    /**
     * Remove a breakpoint.
     * @return false if no breakpoint has that id
     */
    public boolean removeBreakpoint(String breakpointId) {
        Breakpoint removed;
        synchronized (lock) {
            removed = breakpoints.remove(breakpointId);
            if (removed == null) {
                return false;
            }
            Set<String> ids = sessionBreakpoints.get(removed.sessionId());
            if (ids != null) {
                ids.remove(breakpointId);
                if (ids.isEmpty()) {
                    sessionBreakpoints.remove(removed.sessionId());
                }
            }
        }
        events.publish(new DebugEvent.BreakpointRemoved(removed));
        return true;
    }

    /**
     * Enable or disable a breakpoint.
     * @return false if no breakpoint has that id
     */
    public boolean setBreakpointEnabled(String breakpointId, boolean enabled) {
        Breakpoint updated;
        synchronized (lock) {
            updated = breakpoints.computeIfPresent(breakpointId, (k, bp) -> bp.withEnabled(enabled));
        }
        if (updated == null) {
            return false;
        }
        events.publish(new DebugEvent.BreakpointChanged(updated));
        return true;
    }

    public Breakpoint getBreakpoint(String breakpointId) {
        synchronized (lock) {
            return breakpoints.get(breakpointId);
        }
    }

    /**
     * Get all breakpoints of a session in creation order.
     */
    public List<Breakpoint> getBreakpointsForSession(String sessionId) {
        synchronized (lock) {
            Set<String> ids = sessionBreakpoints.get(sessionId);
            if (ids == null) {
                return List.of();
            }
            List<Breakpoint> result = new ArrayList<>(ids.size());
            for (String id : ids) {
                result.add(breakpoints.get(id));
            }
            return result;
        }
    }

    /**
     * Decide whether execution should stop for this context.
     * Breakpoints are tried in creation order and the first matching one wins.
     * Matching log points are counted and reported but never stop execution.
     * @return the breakpoint that was hit (with its updated hit count), or null
     */
    public Breakpoint shouldBreak(ExecutionContext context) {
        synchronized (lock) {
            Set<String> ids = sessionBreakpoints.get(context.sessionId());
            if (ids == null) {
                return null;
            }
            ExpressionEvaluator.EvaluationContext evalContext =
                ExpressionEvaluator.EvaluationContext.of(context.variables());

            for (String id : ids) {
                Breakpoint bp = breakpoints.get(id);
                if (!bp.enabled() || !matches(bp.target(), context)) {
                    continue;
                }
                if (bp.isConditional() && !conditionHolds(bp, evalContext)) {
                    continue;
                }

                Breakpoint hit = bp.withHit(clock.instant());
                breakpoints.put(id, hit);

                if (hit.isLogPoint()) {
                    String message = evaluator.interpolateLogMessage(hit.logMessage(), evalContext);
                    log.info("[Breakpoints] Log point {}: {}", id, message);
                    events.publish(new DebugEvent.LogPointHit(hit, context, message));
                    continue;
                }

                log.debug("[Breakpoints] Hit {} on query {}", hit, context.queryId());
                events.publish(new DebugEvent.BreakpointHit(hit, context));
                return hit;
            }
            return null;
        }
    }

    private boolean conditionHolds(Breakpoint bp, ExpressionEvaluator.EvaluationContext evalContext) {
        try {
            return evaluator.evaluateCondition(bp.condition(), evalContext);
        } catch (IllegalArgumentException e) {
            log.warn("[Breakpoints] Condition '{}' of breakpoint {} failed: {}", bp.condition(), bp.id(), e.getMessage());
            return false;
        }
    }

    private boolean matches(BreakpointTarget target, ExecutionContext context) {
        ExecutionPoint point = context.executionPoint();
        if (target instanceof BreakpointTarget.Query q) {
            if (q.stage() != null && (point == null || point.stage() != q.stage())) {
                return false;
            }
            return q.queryPattern() == null
                || (context.query() != null && q.queryPattern().matcher(context.query()).find());
        }
        if (target instanceof BreakpointTarget.Line l) {
            return point != null
                && Objects.equals(point.procedureId(), l.procedureId())
                && point.lineNumber() != null
                && point.lineNumber() == l.lineNumber();
        }
        // Data, transaction, lock and plan breakpoints need engine hooks that do not exist yet
        return false;
    }

    /**
     * Remove every breakpoint of a session.
     */
    public void clearSessionBreakpoints(String sessionId) {
        synchronized (lock) {
            Set<String> ids = sessionBreakpoints.remove(sessionId);
            if (ids != null) {
                for (String id : ids) {
                    breakpoints.remove(id);
                }
            }
        }
        events.publish(new DebugEvent.SessionBreakpointsCleared(sessionId));
    }

    public BreakpointStatistics getStatistics(String sessionId) {
        List<Breakpoint> list = getBreakpointsForSession(sessionId);
        Map<BreakpointType, Integer> byType = new EnumMap<>(BreakpointType.class);
        int enabled = 0;
        long hits = 0;
        for (Breakpoint bp : list) {
            byType.merge(bp.type(), 1, Integer::sum);
            if (bp.enabled()) {
                enabled++;
            }
            hits += bp.hitCount();
        }
        return new BreakpointStatistics(list.size(), enabled, byType, hits);
    }
}
