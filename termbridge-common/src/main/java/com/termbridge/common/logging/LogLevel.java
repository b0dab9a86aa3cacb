package com.termbridge.common.logging;

import java.util.Map;

/**
 * Log levels accepted in the {@code logging.level} configuration key.
 */
public enum LogLevel {
    SILENT,
    FATAL,
    ERROR,
    WARN,
    INFO,
    DEBUG,
    TRACE;

    private static final Map<String, LogLevel> ALIASES = Map.ofEntries(
            Map.entry("silent", SILENT),
            Map.entry("off", SILENT),
            Map.entry("none", SILENT),
            Map.entry("fatal", FATAL),
            Map.entry("error", ERROR),
            Map.entry("warn", WARN),
            Map.entry("warning", WARN),
            Map.entry("info", INFO),
            Map.entry("debug", DEBUG),
            Map.entry("trace", TRACE));

    /**
     * Resolve a configured level string, falling back when it is blank or
     * unknown.
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
     * Level name understood by Logback / Spring's LoggingSystem.
     */
    public String toSlf4jLevel() {
        return switch (this) {
            case SILENT -> "OFF";
            case FATAL -> "ERROR";
            default -> name();
        };
    }
}
