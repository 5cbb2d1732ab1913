package io.sandcron.core;

import java.util.Optional;

/**
 * How a task's next occurrence is computed.
 */
public enum ScheduleKind {
    CRON("cron"),
    INTERVAL("interval"),
    ONCE("once");

    private final String value;

    ScheduleKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isRecurring() {
        return this != ONCE;
    }

    /**
     * Returns the kind stored as {@code value}, or empty for anything else (including null).
     */
    public static Optional<ScheduleKind> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ScheduleKind kind : values()) {
            if (kind.value.equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
