package com.termbridge.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * SLF4J wrapper that tags every line with a subsystem path and, optionally, the
 * SSH session it belongs to.
 *
 * <p>
 * Usage:
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("session/engine");
 * SubsystemLogger sessionLog = log.forSession("build-box");
 * sessionLog.debug("command started", Map.of("commandId", "b1"));
 * </pre>
 *
 * The SLF4J logger is named {@code termbridge.<subsystem>} with slashes turned
 * into dots, so levels can be tuned per subsystem in logback configuration.
 */
public class SubsystemLogger {

    public static final String MDC_SUBSYSTEM = "subsystem";
    public static final String MDC_SESSION = "session";

    private static final List<String> subsystemFilters = new CopyOnWriteArrayList<>();

    private final String subsystem;
    private final String sessionName;
    private final Logger logger;

    private SubsystemLogger(String subsystem, String sessionName) {
        this.subsystem = subsystem;
        this.sessionName = sessionName;
        this.logger = LoggerFactory.getLogger("termbridge." + subsystem.replace('/', '.'));
    }

    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem, null);
    }

    /**
     * Child logger with an extended subsystem path.
     */
    public SubsystemLogger child(String name) {
        return new SubsystemLogger(subsystem + "/" + name, sessionName);
    }

    /**
     * Same subsystem, bound to one session name.
     */
    public SubsystemLogger forSession(String name) {
        return new SubsystemLogger(subsystem, name);
    }

    public void trace(String message) {
        emit(LogLevel.TRACE, message, null, null);
    }

    public void debug(String message) {
        emit(LogLevel.DEBUG, message, null, null);
    }

    public void debug(String message, Map<String, ?> meta) {
        emit(LogLevel.DEBUG, message, meta, null);
    }

    public void info(String message) {
        emit(LogLevel.INFO, message, null, null);
    }

    public void info(String message, Map<String, ?> meta) {
        emit(LogLevel.INFO, message, meta, null);
    }

    public void warn(String message) {
        emit(LogLevel.WARN, message, null, null);
    }

    public void warn(String message, Map<String, ?> meta) {
        emit(LogLevel.WARN, message, meta, null);
    }

    public void warn(String message, Throwable t) {
        emit(LogLevel.WARN, message, null, t);
    }

    public void error(String message, Map<String, ?> meta) {
        emit(LogLevel.ERROR, message, meta, null);
    }

    public void error(String message, Throwable t) {
        emit(LogLevel.ERROR, message, null, t);
    }

    /**
     * Restrict output to subsystems matching one of the given prefixes. No
     * arguments clears the filter.
     */
    public static void setSubsystemFilter(String... filters) {
        subsystemFilters.clear();
        if (filters != null) {
            Arrays.stream(filters)
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(subsystemFilters::add);
        }
    }

    public boolean shouldLog() {
        if (subsystemFilters.isEmpty()) {
            return true;
        }
        return subsystemFilters.stream().anyMatch(
                prefix -> subsystem.equals(prefix) || subsystem.startsWith(prefix + "/"));
    }

    public String getSubsystem() {
        return subsystem;
    }

    public String getSessionName() {
        return sessionName;
    }

    public Logger getSlf4jLogger() {
        return logger;
    }

    private void emit(LogLevel level, String message, Map<String, ?> meta, Throwable t) {
        if (!shouldLog() || !isEnabled(level)) {
            return;
        }
        MDC.put(MDC_SUBSYSTEM, subsystem);
        if (sessionName != null) {
            MDC.put(MDC_SESSION, sessionName);
        }
        try {
            String formatted = format(message, meta);
            switch (level) {
                case TRACE -> logger.trace(formatted, t);
                case DEBUG -> logger.debug(formatted, t);
                case INFO -> logger.info(formatted, t);
                case WARN -> logger.warn(formatted, t);
                default -> logger.error(formatted, t);
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
            MDC.remove(MDC_SESSION);
        }
    }

    private boolean isEnabled(LogLevel level) {
        return switch (level) {
            case TRACE -> logger.isTraceEnabled();
            case DEBUG -> logger.isDebugEnabled();
            case INFO -> logger.isInfoEnabled();
            case WARN -> logger.isWarnEnabled();
            case SILENT -> false;
            default -> logger.isErrorEnabled();
        };
    }

    String format(String message, Map<String, ?> meta) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(subsystem);
        if (sessionName != null) {
            sb.append(' ').append(sessionName);
        }
        sb.append("] ").append(message);
        if (meta != null && !meta.isEmpty()) {
            sb.append(" {");
            boolean first = true;
            for (var entry : meta.entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(entry.getKey()).append('=').append(entry.getValue());
                first = false;
            }
            sb.append('}');
        }
        return sb.toString();
    }
}
