package com.bosdb.debugger.execution;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Record of one executeQuery call. Immutable - the controller replaces it as the
 * execution progresses.
 */
public record QueryExecution(
    String queryId,
    String sessionId,
    String sql,
    List<Object> parameters,
    Instant startTime,
    Instant endTime,
    Long duration,          // milliseconds, null while running
    Status status,
    QueryResult result,
    Throwable error
) {
    public enum Status {
        RUNNING,
        COMPLETED,
        FAILED
    }

    public QueryExecution {
        parameters = parameters != null ? Collections.unmodifiableList(new ArrayList<>(parameters)) : List.of();
    }

    public static QueryExecution start(String queryId, String sessionId, String sql, List<Object> parameters) {
        return new QueryExecution(queryId, sessionId, sql, parameters, Instant.now(), null, null,
            Status.RUNNING, null, null);
    }

    /**
     * Return a copy marked completed with the aggregated result.
     */
    public QueryExecution completed(QueryResult result) {
        Instant end = Instant.now();
        return new QueryExecution(queryId, sessionId, sql, parameters, startTime, end,
            Duration.between(startTime, end).toMillis(), Status.COMPLETED, result, null);
    }

    /**
     * Return a copy marked failed.
     */
    public QueryExecution failed(Throwable error) {
        Instant end = Instant.now();
        return new QueryExecution(queryId, sessionId, sql, parameters, startTime, end,
            Duration.between(startTime, end).toMillis(), Status.FAILED, null, error);
    }
}
