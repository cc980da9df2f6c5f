package com.bosdb.debugger.runtime;

import com.bosdb.debugger.execution.StatementRunner;
import com.bosdb.debugger.execution.StatementRunnerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens one JDBC connection per debugger connection id, using the URLs from
 * {@link DebuggerSettings}. Connections are opened on first use and reopened if closed.
 */
public class JdbcRunnerFactory implements StatementRunnerFactory, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunnerFactory.class);

    private final DebuggerSettings settings;
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    public JdbcRunnerFactory(DebuggerSettings settings) {
        this.settings = settings;
    }

    @Override
    public StatementRunner forConnection(String connectionId) {
        return (sql, parameters) -> new JdbcStatementRunner(connectionFor(connectionId)).run(sql, parameters);
    }

    synchronized Connection connectionFor(String connectionId) throws SQLException {
        Connection existing = connections.get(connectionId);
        if (existing != null && !existing.isClosed()) {
            return existing;
        }
        String url = settings.getJdbcUrl(connectionId);
        if (url == null) {
            throw new SQLException("No JDBC URL configured for connection: " + connectionId);
        }
        Connection connection = DriverManager.getConnection(url);
        connections.put(connectionId, connection);
        log.info("[JDBC] Opened connection {}", connectionId);
        return connection;
    }

    @Override
    public synchronized void close() {
        for (Map.Entry<String, Connection> entry : connections.entrySet()) {
            try {
                entry.getValue().close();
            } catch (SQLException e) {
                log.warn("[JDBC] Failed to close connection {}", entry.getKey(), e);
            }
        }
        connections.clear();
    }
}
