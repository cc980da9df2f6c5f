package com.bosdb.debugger.inspect;

public record InspectorStatistics(
    int activeTransactions,
    int blockedTransactions,
    int totalLocks,
    int detectedDeadlocks
) {}
