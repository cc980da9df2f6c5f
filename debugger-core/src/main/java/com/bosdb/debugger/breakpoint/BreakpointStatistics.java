package com.bosdb.debugger.breakpoint;

import java.util.Map;

public record BreakpointStatistics(
    int total,
    int enabled,
    Map<BreakpointType, Integer> byType,
    long totalHits
) {
    public BreakpointStatistics {
        byType = Map.copyOf(byType);
    }
}
