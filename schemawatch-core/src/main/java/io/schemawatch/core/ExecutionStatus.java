package io.schemawatch.core;

import java.util.Locale;

public enum ExecutionStatus {
    RUNNING,
    SUCCESS,
    ERROR;

    /**
     * Lower-case name as stored and sent in notifications.
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public static ExecutionStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("status code must not be blank");
        }
        return ExecutionStatus.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
