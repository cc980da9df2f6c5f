package com.bosdb.debugger.inspect;

import java.util.List;

/**
 * Cycles found in the wait-for graph. Each cycle lists transaction ids in wait order.
 */
public record DeadlockReport(List<List<String>> cycles, int count) {
    public DeadlockReport {
        cycles = cycles.stream().map(List::copyOf).toList();
    }

    public boolean hasDeadlock() {
        return count > 0;
    }
}
