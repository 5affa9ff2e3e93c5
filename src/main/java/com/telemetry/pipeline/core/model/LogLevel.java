package com.telemetry.pipeline.core.model;

/**
 * Severity of a {@link LogEntry}, ordered from least to most severe.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /**
     * Returns true if this level is at least as severe as {@code other}.
     */
    public boolean isAtLeast(LogLevel other) {
        return ordinal() >= other.ordinal();
    }

    /**
     * Parses a level name case-insensitively. {@code WARN} is accepted as an alias of {@link #WARNING}.
     *
     * @throws IllegalArgumentException if the value is blank or unknown
     */
    public static LogLevel fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Log level must not be null or blank");
        }
        String normalized = value.trim().toUpperCase();
        if ("WARN".equals(normalized)) {
            return WARNING;
        }
        try {
            return LogLevel.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown log level: " + value);
        }
    }
}
