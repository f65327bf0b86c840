package com.agenthost.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;

/**
 * SLF4J wrapper that tags every line with a subsystem path.
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("client/connection");
 * log.info("Reconnect scheduled", Map.of("sessionId", "s1", "delayMs", 2000));
 * </pre>
 *
 * The subsystem is published under the MDC key {@code subsystem} for the
 * duration of each call, and the SLF4J logger is named
 * {@code agenthost.<subsystem>} so levels can be tuned per subsystem in
 * logback.xml.
 */
public class SubsystemLogger {

    public static final String MDC_SUBSYSTEM = "subsystem";
    private static final String LOGGER_PREFIX = "agenthost.";

    private static volatile LogLevel minLevel = LogLevel.TRACE;

    private final String subsystem;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        this.logger = LoggerFactory.getLogger(LOGGER_PREFIX + subsystem.replace('/', '.'));
    }

    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem);
    }

    /**
     * Most verbose level any subsystem logger emits, from the
     * {@code logging.level} config key. The SLF4J backend can only narrow
     * this further.
     */
    public static void setMinLevel(LogLevel level) {
        minLevel = level == null ? LogLevel.TRACE : level;
    }

    public static LogLevel getMinLevel() {
        return minLevel;
    }

    // -----------------------------------------------------------------------
    // Log methods
    // -----------------------------------------------------------------------

    public void trace(String message, Map<String, Object> meta) {
        emit(LogLevel.TRACE, message, meta, null);
    }

    public void debug(String message) {
        debug(message, null);
    }

    public void debug(String message, Map<String, Object> meta) {
        emit(LogLevel.DEBUG, message, meta, null);
    }

    public void info(String message) {
        info(message, null);
    }

    public void info(String message, Map<String, Object> meta) {
        emit(LogLevel.INFO, message, meta, null);
    }

    public void warn(String message) {
        warn(message, null);
    }

    public void warn(String message, Map<String, Object> meta) {
        emit(LogLevel.WARN, message, meta, null);
    }

    public void error(String message, Map<String, Object> meta) {
        emit(LogLevel.ERROR, message, meta, null);
    }

    public void error(String message, Map<String, Object> meta, Throwable t) {
        emit(LogLevel.ERROR, message, meta, t);
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private void emit(LogLevel level, String message, Map<String, Object> meta, Throwable t) {
        if (!isEnabled(level)) {
            return;
        }
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            String formatted = formatMessage(message, meta);
            switch (level) {
                case TRACE -> logger.trace(formatted);
                case DEBUG -> logger.debug(formatted);
                case INFO -> logger.info(formatted);
                case WARN -> logger.warn(formatted);
                case ERROR -> logger.error(formatted, t);
                case SILENT -> {
                }
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    boolean isEnabled(LogLevel level) {
        if (!level.isEnabledFor(minLevel)) {
            return false;
        }
        return switch (level) {
            case TRACE -> logger.isTraceEnabled();
            case DEBUG -> logger.isDebugEnabled();
            case INFO -> logger.isInfoEnabled();
            case WARN -> logger.isWarnEnabled();
            case ERROR -> logger.isErrorEnabled();
            case SILENT -> false;
        };
    }

    String formatMessage(String message, Map<String, Object> meta) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(subsystem).append("] ").append(message);
        if (meta == null || meta.isEmpty()) {
            return sb.toString();
        }
        sb.append(" {");
        boolean first = true;
        for (var entry : meta.entrySet()) {
            if (!first)
                sb.append(", ");
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        sb.append("}");
        return sb.toString();
    }
}
