package com.bosdb.debugger.runtime;

import com.bosdb.debugger.execution.Field;
import com.bosdb.debugger.execution.QueryResult;
import com.bosdb.debugger.execution.StatementRunner;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs statements on a shared JDBC connection, one at a time.
 */
public class JdbcStatementRunner implements StatementRunner {

    private final Connection connection;

    public JdbcStatementRunner(Connection connection) {
        this.connection = connection;
    }

    @Override
    public QueryResult run(String sql, List<Object> parameters) throws SQLException {
        synchronized (connection) {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                for (int i = 0; i < parameters.size(); i++) {
                    ps.setObject(i + 1, parameters.get(i));
                }
                if (!ps.execute()) {
                    return new QueryResult(List.of(), Math.max(ps.getUpdateCount(), 0), List.of());
                }
                try (ResultSet rs = ps.getResultSet()) {
                    return readResultSet(rs);
                }
            }
        }
    }

    static QueryResult readResultSet(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columns = meta.getColumnCount();

        List<Field> fields = new ArrayList<>(columns);
        for (int c = 1; c <= columns; c++) {
            fields.add(new Field(meta.getColumnLabel(c), meta.getColumnTypeName(c),
                meta.isNullable(c) != ResultSetMetaData.columnNoNulls));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 1; c <= columns; c++) {
                row.put(fields.get(c - 1).name(), rs.getObject(c));
            }
            rows.add(row);
        }
        return new QueryResult(rows, rows.size(), fields);
    }
}
