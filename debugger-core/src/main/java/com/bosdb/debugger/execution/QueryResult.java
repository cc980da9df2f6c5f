package com.bosdb.debugger.execution;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rows returned by one or more statements.
 */
public record QueryResult(
    List<Map<String, Object>> rows,
    int rowCount,
    List<Field> fields
) {
    public QueryResult {
        rows = rows != null ? List.copyOf(rows) : List.of();
        fields = fields != null ? List.copyOf(fields) : List.of();
    }

    public static QueryResult empty() {
        return new QueryResult(List.of(), 0, List.of());
    }

    /**
     * Append another statement's result: rows are concatenated, row counts summed,
     * and fields replaced when the other result carries any.
     */
    public QueryResult merge(QueryResult other) {
        if (other == null) {
            return this;
        }
        List<Map<String, Object>> merged = new ArrayList<>(rows.size() + other.rows().size());
        merged.addAll(rows);
        merged.addAll(other.rows());
        List<Field> mergedFields = other.fields().isEmpty() ? fields : other.fields();
        return new QueryResult(merged, rowCount + other.rowCount(), mergedFields);
    }
}
