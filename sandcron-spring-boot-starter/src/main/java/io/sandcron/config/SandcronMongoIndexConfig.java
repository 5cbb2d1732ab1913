package io.sandcron.config;

import io.sandcron.internal.mongo.ScheduledTaskDocument;
import io.sandcron.internal.mongo.TaskRunLogDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the scheduler collections.
 *
 * <p>Indexes are not created automatically unless {@code sandcron.ensure-indexes-on-startup=true};
 * most deployments manage them with migration scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_due_tasks</b> on {@code scheduled_tasks}: { status: 1, nextRun: 1 }
 *       <br/>Used by the due-task poll.</li>
 *   <li><b>idx_run_logs_task</b> on {@code task_run_logs}: { taskId: 1, runAt: -1 }
 *       <br/>Used by run history lookup, newest first.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.scheduled_tasks.createIndex({ status: 1, nextRun: 1 }, { name: "idx_due_tasks" });
 * db.task_run_logs.createIndex({ taskId: 1, runAt: -1 }, { name: "idx_run_logs_task" });
 * </pre>
 */
public class SandcronMongoIndexConfig {

    public static final String IDX_DUE_TASKS = "idx_due_tasks";
    public static final String IDX_RUN_LOGS_TASK = "idx_run_logs_task";

    private final MongoTemplate mongoTemplate;

    public SandcronMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduledTaskDocument.class).ensureIndex(dueTasksIndex());
        mongoTemplate.indexOps(TaskRunLogDocument.class).ensureIndex(runLogsByTaskIndex());
    }

    /**
     * Keys: status ASC, nextRun ASC
     */
    public static Index dueTasksIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("nextRun", Sort.Direction.ASC)
                .named(IDX_DUE_TASKS);
    }

    /**
     * Keys: taskId ASC, runAt DESC
     */
    public static Index runLogsByTaskIndex() {
        return new Index()
                .on("taskId", Sort.Direction.ASC)
                .on("runAt", Sort.Direction.DESC)
                .named(IDX_RUN_LOGS_TASK);
    }
}
