package com.bosdb.debugger.protocol;

import com.bosdb.debugger.inspect.Variable;

public record VariableView(String name, Object value, String type, String scope, boolean mutable) {

    public static VariableView from(Variable v) {
        return new VariableView(v.name(), v.value(), v.type(), v.scope().wireName(), v.mutable());
    }
}
