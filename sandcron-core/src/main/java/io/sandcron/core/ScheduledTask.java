package io.sandcron.core;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Persisted unit of recurring or one-shot work.
 *
 * <p>Schedule type and status are kept as the stored text so that a row with an unexpected value can
 * still be loaded; use {@link #scheduleKind()} and {@link #isActive()} to interpret them.
 *
 * @param id            unique, stable identifier
 * @param groupFolder   target group; also the name of the group's sandbox directory
 * @param chatJid       target conversation
 * @param prompt        prompt text handed to the agent
 * @param scheduleType  {@code cron}, {@code interval} or {@code once}
 * @param scheduleValue cron expression, interval millis, or ISO-8601 timestamp
 * @param nextRun       next due time; null means due immediately
 * @param lastRun       start of the last execution attempt, nullable
 * @param lastResult    result or error text of the last attempt, nullable
 * @param status        {@code active}, {@code completed}, {@code failed} or {@code paused}
 * @param createdAt     creation time
 * @param contextMode   context isolation mode tag (e.g. {@code isolated})
 */
public record ScheduledTask(
        String id,
        String groupFolder,
        String chatJid,
        String prompt,
        String scheduleType,
        String scheduleValue,
        Instant nextRun,
        Instant lastRun,
        String lastResult,
        String status,
        Instant createdAt,
        String contextMode
) {
    public static final String DEFAULT_CONTEXT_MODE = "isolated";

    public ScheduledTask {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(groupFolder, "groupFolder must not be null");
        Objects.requireNonNull(prompt, "prompt must not be null");
        if (status == null) {
            status = TaskStatus.ACTIVE.value();
        }
        if (contextMode == null) {
            contextMode = DEFAULT_CONTEXT_MODE;
        }
    }

    public Optional<ScheduleKind> scheduleKind() {
        return ScheduleKind.fromValue(scheduleType);
    }

    public boolean isActive() {
        return TaskStatus.ACTIVE.value().equals(status);
    }

    public boolean isOnce() {
        return ScheduleKind.ONCE.value().equals(scheduleType);
    }

    /**
     * Due when active and the next run is unset or not after {@code now}.
     */
    public boolean isDue(Instant now) {
        return isActive() && (nextRun == null || !nextRun.isAfter(now));
    }

    public ScheduledTask withStatus(TaskStatus newStatus) {
        return new ScheduledTask(id, groupFolder, chatJid, prompt, scheduleType, scheduleValue,
                nextRun, lastRun, lastResult, newStatus.value(), createdAt, contextMode);
    }

    public ScheduledTask withNextRun(Instant newNextRun) {
        return new ScheduledTask(id, groupFolder, chatJid, prompt, scheduleType, scheduleValue,
                newNextRun, lastRun, lastResult, status, createdAt, contextMode);
    }

    public ScheduledTask withLastRun(Instant runAt, String result) {
        return new ScheduledTask(id, groupFolder, chatJid, prompt, scheduleType, scheduleValue,
                nextRun, runAt, result, status, createdAt, contextMode);
    }
}
