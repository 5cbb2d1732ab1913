package io.sandcron.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one execution attempt. Appended once, never updated.
 */
public record TaskRunLog(
        String taskId,
        Instant runAt,
        long durationMs,
        RunStatus status,
        String result,
        String error
) {
    public TaskRunLog {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(runAt, "runAt must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must not be negative");
        }
    }
}
