package com.bosdb.debugger.execution;

/**
 * Stage of query processing an execution point belongs to.
 */
public enum QueryStage {
    PARSE,
    ANALYZE,
    REWRITE,
    PLAN,
    EXECUTE,
    COMPLETE;

    /**
     * Parse a stage name case-insensitively ("execute", "EXECUTE").
     */
    public static QueryStage fromName(String name) {
        return valueOf(name.trim().toUpperCase());
    }
}
