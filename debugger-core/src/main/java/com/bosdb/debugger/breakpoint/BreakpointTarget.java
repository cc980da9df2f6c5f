package com.bosdb.debugger.breakpoint;

import com.bosdb.debugger.execution.QueryStage;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Where a breakpoint applies. One variant per {@link BreakpointType}.
 */
public sealed interface BreakpointTarget {

    BreakpointType type();

    /**
     * Stops on statements whose text matches {@code queryPattern} (find semantics).
     * Null stage or pattern means "any".
     */
    record Query(QueryStage stage, Pattern queryPattern) implements BreakpointTarget {
        @Override
        public BreakpointType type() {
            return BreakpointType.QUERY;
        }
    }

    record Line(String procedureId, int lineNumber) implements BreakpointTarget {
        @Override
        public BreakpointType type() {
            return BreakpointType.LINE;
        }
    }

    record Data(String expression, String changeType) implements BreakpointTarget {
        @Override
        public BreakpointType type() {
            return BreakpointType.DATA;
        }
    }

    record Transaction(String event, String isolationLevel) implements BreakpointTarget {
        @Override
        public BreakpointType type() {
            return BreakpointType.TRANSACTION;
        }
    }

    record Lock(String event, String lockType) implements BreakpointTarget {
        @Override
        public BreakpointType type() {
            return BreakpointType.LOCK;
        }
    }

    record Plan(String nodeType) implements BreakpointTarget {
        @Override
        public BreakpointType type() {
            return BreakpointType.PLAN;
        }
    }

    /**
     * Query breakpoint from a regular expression.
     * @throws IllegalArgumentException if the pattern does not compile
     */
    static Query query(QueryStage stage, String regex) {
        if (regex == null || regex.isEmpty()) {
            return new Query(stage, null);
        }
        try {
            return new Query(stage, Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid query pattern: " + regex, e);
        }
    }

    static Query query(String regex) {
        return query(null, regex);
    }

    static Line line(String procedureId, int lineNumber) {
        return new Line(procedureId, lineNumber);
    }

    static Data data(String expression, String changeType) {
        return new Data(expression, changeType);
    }

    static Transaction transaction(String event, String isolationLevel) {
        return new Transaction(event, isolationLevel);
    }

    static Lock lock(String event, String lockType) {
        return new Lock(event, lockType);
    }

    static Plan plan(String nodeType) {
        return new Plan(nodeType);
    }
}
