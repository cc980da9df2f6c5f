package com.bosdb.debugger.inspect;

public enum VariableScope {
    LOCAL,
    SESSION,
    GLOBAL;

    public String wireName() {
        return name().toLowerCase();
    }
}
