package io.sandcron.core;

import java.util.Optional;

/**
 * Lifecycle status of a {@link ScheduledTask}. Only {@link #ACTIVE} tasks are ever selected as due.
 */
public enum TaskStatus {
    ACTIVE("active"),
    COMPLETED("completed"),
    FAILED("failed"),
    PAUSED("paused");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<TaskStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (TaskStatus status : values()) {
            if (status.value.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    /**
     * Status a task ends up in after one execution attempt.
     */
    public static TaskStatus afterRun(boolean success, boolean once) {
        if (!success) {
            return FAILED;
        }
        return once ? COMPLETED : ACTIVE;
    }
}
