package com.bosdb.debugger.inspect;

import com.bosdb.debugger.eval.Value;

/**
 * A named value visible to the debugger.
 */
public record Variable(
    String name,
    Object value,       // may be null
    String type,
    VariableScope scope,
    boolean mutable
) {
    /**
     * Create a mutable variable, deriving the type name from the value.
     */
    public static Variable of(String name, Object value, VariableScope scope) {
        return new Variable(name, value, Value.of(value).typeName(), scope, true);
    }
}
