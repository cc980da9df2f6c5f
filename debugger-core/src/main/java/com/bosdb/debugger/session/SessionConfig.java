package com.bosdb.debugger.session;

/**
 * Per-session debugger settings.
 */
public record SessionConfig(
    String database,
    DebugLevel debugLevel,
    boolean autoBreakOnError,
    int maxHistorySize,
    boolean enableTimeTravel
) {
    public static final int DEFAULT_MAX_HISTORY_SIZE = 1000;

    public SessionConfig {
        if (maxHistorySize <= 0) {
            throw new IllegalArgumentException("maxHistorySize must be positive: " + maxHistorySize);
        }
        database = database != null ? database : "";
        debugLevel = debugLevel != null ? debugLevel : DebugLevel.NORMAL;
    }

    public static SessionConfig defaults() {
        return new SessionConfig("", DebugLevel.NORMAL, true, DEFAULT_MAX_HISTORY_SIZE, true);
    }

    /**
     * Apply caller overrides on top of the defaults. Null fields keep the default.
     */
    public static SessionConfig from(Overrides overrides) {
        SessionConfig d = defaults();
        if (overrides == null) {
            return d;
        }
        return new SessionConfig(
            overrides.database() != null ? overrides.database() : d.database(),
            overrides.debugLevel() != null ? overrides.debugLevel() : d.debugLevel(),
            overrides.autoBreakOnError() != null ? overrides.autoBreakOnError() : d.autoBreakOnError(),
            overrides.maxHistorySize() != null ? overrides.maxHistorySize() : d.maxHistorySize(),
            overrides.enableTimeTravel() != null ? overrides.enableTimeTravel() : d.enableTimeTravel()
        );
    }

    /**
     * Partial configuration supplied at session creation.
     */
    public record Overrides(
        String database,
        DebugLevel debugLevel,
        Boolean autoBreakOnError,
        Integer maxHistorySize,
        Boolean enableTimeTravel
    ) {
        public static Overrides none() {
            return new Overrides(null, null, null, null, null);
        }

        public Overrides withDatabase(String database) {
            return new Overrides(database, debugLevel, autoBreakOnError, maxHistorySize, enableTimeTravel);
        }

        public Overrides withDebugLevel(DebugLevel debugLevel) {
            return new Overrides(database, debugLevel, autoBreakOnError, maxHistorySize, enableTimeTravel);
        }

        public Overrides withMaxHistorySize(int maxHistorySize) {
            return new Overrides(database, debugLevel, autoBreakOnError, maxHistorySize, enableTimeTravel);
        }
    }
}
