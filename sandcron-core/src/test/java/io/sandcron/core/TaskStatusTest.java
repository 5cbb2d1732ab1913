package io.sandcron.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskStatusTest {

    @Test
    void afterRunShouldFailOnAnyUnsuccessfulRun() {
        assertEquals(TaskStatus.FAILED, TaskStatus.afterRun(false, true));
        assertEquals(TaskStatus.FAILED, TaskStatus.afterRun(false, false));
    }

    @Test
    void afterRunShouldCompleteOnlySuccessfulOneTimeTasks() {
        assertEquals(TaskStatus.COMPLETED, TaskStatus.afterRun(true, true));
        assertEquals(TaskStatus.ACTIVE, TaskStatus.afterRun(true, false));
    }

    @Test
    void fromValueShouldBeLenient() {
        assertEquals(Optional.of(TaskStatus.PAUSED), TaskStatus.fromValue("paused"));
        assertEquals(Optional.empty(), TaskStatus.fromValue("archived"));
        assertEquals(Optional.empty(), TaskStatus.fromValue(null));
    }

    @Test
    void scheduledTaskShouldBeDueOnlyWhenActiveAndNotInTheFuture() {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        ScheduledTask task = new ScheduledTask("t", "main", null, "p", "interval", "1000",
                null, null, null, null, now, null);

        assertEquals("active", task.status());
        assertEquals(ScheduledTask.DEFAULT_CONTEXT_MODE, task.contextMode());
        assertTrue(task.isDue(now));
        assertTrue(task.withNextRun(now).isDue(now));
        assertFalse(task.withNextRun(now.plusMillis(1)).isDue(now));
        assertFalse(task.withStatus(TaskStatus.PAUSED).isDue(now));
    }

    @Test
    void scheduledRequestShouldDeriveSessionFromTaskId() {
        ScheduledTask task = new ScheduledTask("abc", "team", "chat@2", "summarize", "once", "2026-01-01T00:00:00Z",
                null, null, null, "active", Instant.EPOCH, null);

        ExecutionRequest request = ExecutionRequest.forScheduledTask(task);

        assertEquals("scheduled_abc", request.sessionId());
        assertEquals("team", request.groupFolder());
        assertEquals("chat@2", request.chatJid());
        assertFalse(request.main());
        assertTrue(request.scheduledTask());
    }
}
