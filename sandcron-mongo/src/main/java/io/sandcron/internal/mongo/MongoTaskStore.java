package io.sandcron.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.sandcron.TaskStore;
import io.sandcron.core.RunStatus;
import io.sandcron.core.ScheduledTask;
import io.sandcron.core.TaskRunLog;
import io.sandcron.core.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for scheduled tasks and their run history.
 *
 * <p>Every write is a single-document update keyed by task id, so concurrent calls from different
 * executions never interfere with each other.
 */
public class MongoTaskStore implements TaskStore {
    private static final Logger log = LoggerFactory.getLogger(MongoTaskStore.class);

    private final MongoTemplate mongoTemplate;

    public MongoTaskStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Insert a new task.
     *
     * @throws org.springframework.dao.DuplicateKeyException if a task with the same id exists
     */
    public ScheduledTask createTask(ScheduledTask task) {
        Objects.requireNonNull(task, "task must not be null");
        mongoTemplate.insert(toDocument(task));
        return task;
    }

    @Override
    public List<ScheduledTask> listDueTasks(Instant now) {
        Objects.requireNonNull(now, "now must not be null");

        Query q = new Query(
                Criteria.where("status").is(TaskStatus.ACTIVE.value())
                        .orOperator(
                                Criteria.where("nextRun").is(null),
                                Criteria.where("nextRun").lte(now)
                        )
        );
        // ascending puts null (due immediately) first
        q.with(Sort.by(Sort.Order.asc("nextRun")));

        List<ScheduledTaskDocument> docs = mongoTemplate.find(q, ScheduledTaskDocument.class);
        List<ScheduledTask> tasks = new ArrayList<>(docs.size());
        for (ScheduledTaskDocument d : docs) {
            tasks.add(toTask(d));
        }
        return tasks;
    }

    @Override
    public Optional<ScheduledTask> getTask(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        ScheduledTaskDocument doc = mongoTemplate.findById(taskId, ScheduledTaskDocument.class);
        return Optional.ofNullable(doc).map(MongoTaskStore::toTask);
    }

    @Override
    public void appendRunLog(TaskRunLog runLog) {
        Objects.requireNonNull(runLog, "runLog must not be null");
        TaskRunLogDocument doc = new TaskRunLogDocument();
        doc.setTaskId(runLog.taskId());
        doc.setRunAt(runLog.runAt());
        doc.setDurationMs(runLog.durationMs());
        doc.setStatus(runLog.status().value());
        doc.setResult(runLog.result());
        doc.setError(runLog.error());
        mongoTemplate.insert(doc);
    }

    @Override
    public void updateLastRun(String taskId, Instant runAt, String lastResult) {
        Objects.requireNonNull(runAt, "runAt must not be null");
        Update u = new Update().set("lastRun", runAt);
        if (lastResult != null) {
            u.set("lastResult", lastResult);
        } else {
            u.unset("lastResult");
        }
        updateById(taskId, u, "updateLastRun");
    }

    @Override
    public void updateNextRun(String taskId, Instant nextRun) {
        Objects.requireNonNull(nextRun, "nextRun must not be null");
        updateById(taskId, new Update().set("nextRun", nextRun), "updateNextRun");
    }

    @Override
    public void markCompleted(String taskId) {
        Update u = new Update()
                .set("status", TaskStatus.COMPLETED.value())
                .set("nextRun", null);
        updateById(taskId, u, "markCompleted");
    }

    @Override
    public void markFailed(String taskId) {
        updateById(taskId, new Update().set("status", TaskStatus.FAILED.value()), "markFailed");
    }

    /**
     * Run history of one task, newest first.
     */
    public List<TaskRunLog> findRunLogs(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Query q = new Query(Criteria.where("taskId").is(taskId));
        q.with(Sort.by(Sort.Order.desc("runAt")));

        List<TaskRunLogDocument> docs = mongoTemplate.find(q, TaskRunLogDocument.class);
        List<TaskRunLog> logs = new ArrayList<>(docs.size());
        for (TaskRunLogDocument d : docs) {
            logs.add(new TaskRunLog(
                    d.getTaskId(),
                    d.getRunAt(),
                    d.getDurationMs(),
                    RunStatus.fromValue(d.getStatus()),
                    d.getResult(),
                    d.getError()
            ));
        }
        return logs;
    }

    private void updateById(String taskId, Update update, String operation) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Query q = new Query(Criteria.where("_id").is(taskId));
        UpdateResult r = mongoTemplate.updateFirst(q, update, ScheduledTaskDocument.class);
        if (r.getMatchedCount() == 0) {
            log.debug("{} matched no task taskId={}", operation, taskId);
        }
    }

    static ScheduledTaskDocument toDocument(ScheduledTask task) {
        ScheduledTaskDocument doc = new ScheduledTaskDocument();
        doc.setId(task.id());
        doc.setGroupFolder(task.groupFolder());
        doc.setChatJid(task.chatJid());
        doc.setPrompt(task.prompt());
        doc.setScheduleType(task.scheduleType());
        doc.setScheduleValue(task.scheduleValue());
        doc.setNextRun(task.nextRun());
        doc.setLastRun(task.lastRun());
        doc.setLastResult(task.lastResult());
        doc.setStatus(task.status());
        doc.setCreatedAt(task.createdAt() != null ? task.createdAt() : Instant.now());
        doc.setContextMode(task.contextMode());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(ScheduledTask)}.
     */
    static ScheduledTask toTask(ScheduledTaskDocument doc) {
        return new ScheduledTask(
                doc.getId(),
                doc.getGroupFolder(),
                doc.getChatJid(),
                doc.getPrompt(),
                doc.getScheduleType(),
                doc.getScheduleValue(),
                doc.getNextRun(),
                doc.getLastRun(),
                doc.getLastResult(),
                doc.getStatus(),
                doc.getCreatedAt(),
                doc.getContextMode()
        );
    }
}
