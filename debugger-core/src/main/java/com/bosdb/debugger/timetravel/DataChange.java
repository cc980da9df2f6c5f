package com.bosdb.debugger.timetravel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows touched by one DML statement, as captured before and after it ran.
 * Row maps keep column order; values may be null.
 */
public record DataChange(
    Operation operation,
    String table,
    List<String> pkFields,
    List<Map<String, Object>> oldRows,
    List<Map<String, Object>> newRows
) {
    public enum Operation {
        INSERT,
        UPDATE,
        DELETE
    }

    public DataChange {
        pkFields = pkFields != null ? List.copyOf(pkFields) : List.of();
        oldRows = copyRows(oldRows);
        newRows = copyRows(newRows);
    }

    private static List<Map<String, Object>> copyRows(List<Map<String, Object>> rows) {
        if (rows == null) {
            return List.of();
        }
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        return Collections.unmodifiableList(copy);
    }

    public static DataChange insert(String table, List<String> pkFields, List<Map<String, Object>> newRows) {
        return new DataChange(Operation.INSERT, table, pkFields, List.of(), newRows);
    }

    public static DataChange update(String table, List<String> pkFields, List<Map<String, Object>> oldRows) {
        return new DataChange(Operation.UPDATE, table, pkFields, oldRows, List.of());
    }

    public static DataChange delete(String table, List<Map<String, Object>> oldRows) {
        return new DataChange(Operation.DELETE, table, List.of(), oldRows, List.of());
    }
}
