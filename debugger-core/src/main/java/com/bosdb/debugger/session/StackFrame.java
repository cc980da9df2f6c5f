package com.bosdb.debugger.session;

/**
 * A frame of a paused session's call stack.
 */
public record StackFrame(
    int id,
    String name,
    Integer lineNumber,
    String procedureId
) {}
