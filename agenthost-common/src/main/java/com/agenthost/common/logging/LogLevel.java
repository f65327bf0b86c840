package com.agenthost.common.logging;

import java.util.Map;

/**
 * Log levels understood by {@link SubsystemLogger} and the {@code logging.level}
 * config key.
 */
public enum LogLevel {
    SILENT,
    ERROR,
    WARN,
    INFO,
    DEBUG,
    TRACE;

    private static final Map<String, LogLevel> ALIASES = Map.of(
            "silent", SILENT,
            "off", SILENT,
            "error", ERROR,
            "warn", WARN,
            "warning", WARN,
            "info", INFO,
            "debug", DEBUG,
            "trace", TRACE);

    /**
     * Normalize an arbitrary string to a LogLevel, falling back to the given
     * default.
     */
    public static LogLevel normalize(String level, LogLevel fallback) {
        if (level == null || level.isBlank()) {
            return fallback;
        }
        LogLevel resolved = ALIASES.get(level.trim().toLowerCase());
        return resolved != null ? resolved : fallback;
    }

    public static LogLevel normalize(String level) {
        return normalize(level, INFO);
    }

    /**
     * Lower is more severe. SILENT never logs.
     */
    public int priority() {
        return switch (this) {
            case ERROR -> 1;
            case WARN -> 2;
            case INFO -> 3;
            case DEBUG -> 4;
            case TRACE -> 5;
            case SILENT -> Integer.MAX_VALUE;
        };
    }

    public boolean isEnabledFor(LogLevel minLevel) {
        if (minLevel == SILENT) {
            return false;
        }
        return this.priority() <= minLevel.priority();
    }
}
