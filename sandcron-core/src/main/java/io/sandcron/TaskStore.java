package io.sandcron;

import io.sandcron.core.ScheduledTask;
import io.sandcron.core.TaskRunLog;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Task store boundary used by the scheduler loop.
 *
 * <p>Implementations must be safe for concurrent use by the poll driver and every in-flight execution,
 * and each operation must be atomic with respect to the row it touches.
 */
public interface TaskStore {

    /**
     * Active tasks whose next run is null or not after {@code now}, ordered by next run ascending with
     * nulls first.
     */
    List<ScheduledTask> listDueTasks(Instant now);

    Optional<ScheduledTask> getTask(String taskId);

    void appendRunLog(TaskRunLog runLog);

    void updateLastRun(String taskId, Instant runAt, String lastResult);

    void updateNextRun(String taskId, Instant nextRun);

    /**
     * Sets status {@code completed} and clears the next run.
     */
    void markCompleted(String taskId);

    /**
     * Sets status {@code failed}; scheduling fields are left alone.
     */
    void markFailed(String taskId);
}
