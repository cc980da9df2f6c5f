package com.bosdb.debugger.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

/**
 * Server settings. Each key is read from, in order of precedence, the matching
 * environment variable ({@code debugger.http.port} becomes {@code DEBUGGER_HTTP_PORT}),
 * a system property, then {@code debugger.properties} on the classpath.
 */
public class DebuggerSettings {

    private static final Logger log = LoggerFactory.getLogger(DebuggerSettings.class);

    public static final String RESOURCE = "debugger.properties";

    public static final String HTTP_PORT = "debugger.http.port";
    public static final String WS_PORT = "debugger.ws.port";
    public static final String WS_PATH = "debugger.ws.path";
    public static final String MAX_SESSIONS_PER_USER = "debugger.sessions.maxPerUser";
    public static final String MAX_SESSION_AGE_MINUTES = "debugger.sessions.maxAgeMinutes";
    public static final String REAP_INTERVAL_MINUTES = "debugger.sessions.reapIntervalMinutes";
    public static final String JDBC_URL_PREFIX = "debugger.jdbc.url.";

    private final Properties file;
    private final Properties system;
    private final Map<String, String> env;

    public DebuggerSettings(Properties file, Properties system, Map<String, String> env) {
        this.file = file;
        this.system = system;
        this.env = env;
    }

    /**
     * Load settings from the classpath resource, system properties and the environment.
     */
    public static DebuggerSettings load() {
        return new DebuggerSettings(loadResource(RESOURCE), System.getProperties(), System.getenv());
    }

    static Properties loadResource(String name) {
        Properties props = new Properties();
        try (InputStream is = DebuggerSettings.class.getClassLoader().getResourceAsStream(name)) {
            if (is == null) {
                log.warn("[Settings] {} not found on classpath, using defaults", name);
                return props;
            }
            props.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + name, e);
        }
        return props;
    }

    public int getHttpPort() {
        return getInt(HTTP_PORT, 8080);
    }

    public int getWsPort() {
        return getInt(WS_PORT, 8081);
    }

    public String getWsPath() {
        return get(WS_PATH, "/debug");
    }

    public int getMaxSessionsPerUser() {
        return getInt(MAX_SESSIONS_PER_USER, 5);
    }

    public Duration getMaxSessionAge() {
        return Duration.ofMinutes(getInt(MAX_SESSION_AGE_MINUTES, 1440));
    }

    public Duration getReapInterval() {
        return Duration.ofMinutes(getInt(REAP_INTERVAL_MINUTES, 10));
    }

    /**
     * @return the JDBC URL configured for a debugger connection id, or null
     */
    public String getJdbcUrl(String connectionId) {
        return get(JDBC_URL_PREFIX + connectionId, null);
    }

    public String get(String key, String defaultValue) {
        String value = env.get(envName(key));
        if (value == null) {
            value = system.getProperty(key);
        }
        if (value == null) {
            value = file.getProperty(key);
        }
        return value != null ? value.trim() : defaultValue;
    }

    /**
     * @throws IllegalArgumentException if the value is not an integer
     */
    public int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    static String envName(String key) {
        return key.toUpperCase().replace('.', '_');
    }
}
