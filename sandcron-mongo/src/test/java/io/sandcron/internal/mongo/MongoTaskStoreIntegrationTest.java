package io.sandcron.internal.mongo;

import com.mongodb.client.MongoClients;
import io.sandcron.config.SchedulerProperties;
import io.sandcron.core.ExecutionOutcome;
import io.sandcron.core.ExecutionResult;
import io.sandcron.core.RunStatus;
import io.sandcron.core.ScheduledTask;
import io.sandcron.core.TaskRunLog;
import io.sandcron.core.TaskStatus;
import io.sandcron.internal.PollingTaskScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoTaskStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    // Mongo stores millisecond precision
    private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    private MongoTemplate mongoTemplate;
    private MongoTaskStore taskStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "sandcron_test");
        mongoTemplate.dropCollection(ScheduledTaskDocument.class);
        mongoTemplate.dropCollection(TaskRunLogDocument.class);
        taskStore = new MongoTaskStore(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(ScheduledTaskDocument.class);
        mongoTemplate.dropCollection(TaskRunLogDocument.class);
    }

    @Test
    void listDueTasksShouldReturnActiveDueTasksEarliestFirst() {
        taskStore.createTask(task("later", NOW.minusSeconds(5)));
        taskStore.createTask(task("earlier", NOW.minusSeconds(60)));
        taskStore.createTask(task("immediate", null));
        taskStore.createTask(task("future", NOW.plusSeconds(60)));
        taskStore.createTask(task("paused", NOW.minusSeconds(60)).withStatus(TaskStatus.PAUSED));

        List<ScheduledTask> due = taskStore.listDueTasks(NOW);

        assertEquals(List.of("immediate", "earlier", "later"), due.stream().map(ScheduledTask::id).toList());
    }

    @Test
    void taskShouldRoundTripThroughTheStore() {
        ScheduledTask created = taskStore.createTask(task("t1", NOW));

        Optional<ScheduledTask> loaded = taskStore.getTask("t1");

        assertTrue(loaded.isPresent());
        assertEquals(created, loaded.get());
        assertFalse(taskStore.getTask("missing").isPresent());
    }

    @Test
    void updatesShouldTouchOnlyTheirFields() {
        taskStore.createTask(task("t1", NOW));

        taskStore.updateLastRun("t1", NOW.plusSeconds(1), "done");
        taskStore.updateNextRun("t1", NOW.plusSeconds(3600));

        ScheduledTask after = taskStore.getTask("t1").orElseThrow();
        assertEquals(NOW.plusSeconds(1), after.lastRun());
        assertEquals("done", after.lastResult());
        assertEquals(NOW.plusSeconds(3600), after.nextRun());
        assertEquals("active", after.status());

        taskStore.markFailed("t1");
        ScheduledTask failed = taskStore.getTask("t1").orElseThrow();
        assertEquals("failed", failed.status());
        assertEquals(NOW.plusSeconds(3600), failed.nextRun());
    }

    @Test
    void markCompletedShouldClearNextRun() {
        taskStore.createTask(task("t1", NOW));

        taskStore.markCompleted("t1");

        ScheduledTask after = taskStore.getTask("t1").orElseThrow();
        assertEquals("completed", after.status());
        assertNull(after.nextRun());
        assertTrue(taskStore.listDueTasks(NOW.plusSeconds(3600)).isEmpty());
    }

    @Test
    void runLogsShouldBeAppendOnlyAndNewestFirst() {
        taskStore.appendRunLog(new TaskRunLog("t1", NOW.minusSeconds(120), 1500, RunStatus.SUCCESS, "first", null));
        taskStore.appendRunLog(new TaskRunLog("t1", NOW.minusSeconds(60), 600_000, RunStatus.TIMEOUT, null, "timed out"));
        taskStore.appendRunLog(new TaskRunLog("t2", NOW, 10, RunStatus.ERROR, null, "other task"));

        List<TaskRunLog> logs = taskStore.findRunLogs("t1");

        assertEquals(2, logs.size());
        assertEquals(RunStatus.TIMEOUT, logs.get(0).status());
        assertEquals("timed out", logs.get(0).error());
        assertEquals(600_000, logs.get(0).durationMs());
        assertEquals(RunStatus.SUCCESS, logs.get(1).status());
        assertEquals("first", logs.get(1).result());
    }

    @Test
    void schedulerShouldRunDueTaskAgainstMongo() throws Exception {
        taskStore.createTask(task("hourly", NOW.minusSeconds(1)));

        SchedulerProperties props = new SchedulerProperties();
        props.setPollInterval(Duration.ofMillis(200));
        props.setTaskTimeout(Duration.ofSeconds(5));
        props.setMaxConcurrentTasks(1);

        PollingTaskScheduler scheduler = new PollingTaskScheduler(props, taskStore, (request, timeout) ->
                new ExecutionOutcome(ExecutionResult.success("checked " + request.sessionId()), Duration.ofMillis(5), false),
                null);
        scheduler.start();

        boolean reached = waitUntil(8, TimeUnit.SECONDS, () -> !taskStore.findRunLogs("hourly").isEmpty());

        scheduler.stop();

        assertTrue(reached);
        ScheduledTask after = taskStore.getTask("hourly").orElseThrow();
        assertEquals("active", after.status());
        assertEquals("checked scheduled_hourly", after.lastResult());
        assertNotNull(after.nextRun());
        assertTrue(after.nextRun().isAfter(NOW.plusSeconds(3000)));
    }

    @Test
    void taskPausedInTheDatabaseShouldNotBeSelected() {
        taskStore.createTask(task("t1", NOW.minusSeconds(1)));

        mongoTemplate.updateFirst(new Query(Criteria.where("_id").is("t1")),
                new Update().set("status", "paused"), ScheduledTaskDocument.class);

        assertTrue(taskStore.listDueTasks(NOW).isEmpty());
    }

    private static ScheduledTask task(String id, Instant nextRun) {
        return new ScheduledTask(id, "main", "chat@1", "check the build", "interval", "3600000",
                nextRun, null, null, "active", NOW.minusSeconds(86_400), "isolated");
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(100);
        }
        return false;
    }
}
