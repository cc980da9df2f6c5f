package com.bosdb.debugger.execution;

/**
 * Step command variants. Without a procedure call stack all three advance
 * to the next execution point.
 */
public enum StepType {
    OVER,
    INTO,
    OUT;

    public String wireName() {
        return name().toLowerCase();
    }
}
