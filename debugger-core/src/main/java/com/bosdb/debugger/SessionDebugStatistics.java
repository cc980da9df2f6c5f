package com.bosdb.debugger;

import com.bosdb.debugger.breakpoint.BreakpointStatistics;

public record SessionDebugStatistics(BreakpointStatistics breakpoints, int executionPoints) {}
