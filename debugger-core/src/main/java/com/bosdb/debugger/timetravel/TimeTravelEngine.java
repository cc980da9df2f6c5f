package com.bosdb.debugger.timetravel;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Generates SQL that undoes a captured {@link DataChange}.
 * The statements are returned, never executed here.
 */
public class TimeTravelEngine {

    /**
     * Inverse SQL for a change, or an empty string when there is nothing to undo.
     */
    public String generateInverseSql(DataChange change) {
        return switch (change.operation()) {
            case INSERT -> inverseInsert(change.table(), change.pkFields(), change.newRows());
            case UPDATE -> inverseUpdate(change.table(), change.pkFields(), change.oldRows());
            case DELETE -> inverseDelete(change.table(), change.oldRows());
        };
    }

    private String inverseInsert(String table, List<String> pks, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) return "";
        StringJoiner conditions = new StringJoiner(" OR ");
        for (Map<String, Object> row : rows) {
            conditions.add("(" + pkCondition(pks, row) + ")");
        }
        return "DELETE FROM " + quote(table) + " WHERE " + conditions + ";";
    }

    private String inverseUpdate(String table, List<String> pks, List<Map<String, Object>> oldRows) {
        List<String> statements = new ArrayList<>();
        for (Map<String, Object> row : oldRows) {
            StringJoiner sets = new StringJoiner(", ");
            for (Map.Entry<String, Object> entry : row.entrySet()) {
                if (!pks.contains(entry.getKey())) {
                    sets.add(quote(entry.getKey()) + " = " + formatValue(entry.getValue()));
                }
            }
            statements.add("UPDATE " + quote(table) + " SET " + sets + " WHERE " + pkCondition(pks, row) + ";");
        }
        return String.join("\n", statements);
    }

    private String inverseDelete(String table, List<Map<String, Object>> oldRows) {
        if (oldRows.isEmpty()) return "";
        List<String> columns = new ArrayList<>(oldRows.get(0).keySet());

        StringJoiner columnList = new StringJoiner(", ");
        for (String column : columns) {
            columnList.add(quote(column));
        }
        StringJoiner values = new StringJoiner(",\n");
        for (Map<String, Object> row : oldRows) {
            StringJoiner tuple = new StringJoiner(", ", "(", ")");
            for (String column : columns) {
                tuple.add(formatValue(row.get(column)));
            }
            values.add(tuple.toString());
        }
        return "INSERT INTO " + quote(table) + " (" + columnList + ")\nVALUES " + values + ";";
    }

    private String pkCondition(List<String> pks, Map<String, Object> row) {
        StringJoiner where = new StringJoiner(" AND ");
        for (String pk : pks) {
            where.add(quote(pk) + " = " + formatValue(row.get(pk)));
        }
        return where.toString();
    }

    private static String quote(String identifier) {
        return "\"" + identifier + "\"";
    }

    static String formatValue(Object value) {
        if (value == null) return "NULL";
        if (value instanceof CharSequence s) return "'" + s.toString().replace("'", "''") + "'";
        // java.sql.Date and Time have no instant form
        if (value instanceof java.sql.Date || value instanceof java.sql.Time) return "'" + value + "'";
        if (value instanceof Date d) return "'" + d.toInstant() + "'";
        if (value instanceof TemporalAccessor) return "'" + value + "'";
        return String.valueOf(value);
    }
}
