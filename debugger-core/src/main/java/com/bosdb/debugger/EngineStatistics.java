package com.bosdb.debugger;

import com.bosdb.debugger.inspect.InspectorStatistics;
import com.bosdb.debugger.session.SessionStatistics;

public record EngineStatistics(SessionStatistics sessions, InspectorStatistics state) {}
