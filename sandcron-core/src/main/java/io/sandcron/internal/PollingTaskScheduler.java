package io.sandcron.internal;

import io.sandcron.ExecutionRunner;
import io.sandcron.TaskScheduler;
import io.sandcron.TaskStore;
import io.sandcron.config.SchedulerProperties;
import io.sandcron.core.ExecutionInfrastructureException;
import io.sandcron.core.ExecutionOutcome;
import io.sandcron.core.ExecutionRequest;
import io.sandcron.core.ExecutionResult;
import io.sandcron.core.RunStatus;
import io.sandcron.core.ScheduledTask;
import io.sandcron.core.TaskRunLog;
import io.sandcron.core.TaskStatus;
import io.sandcron.internal.sandbox.RunOutputJournal;
import io.sandcron.utils.DurationFormat;
import io.sandcron.utils.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polling scheduler loop.
 *
 * <p>One poller thread ticks every {@code pollInterval}. Each tick selects the due tasks and dispatches
 * them, earliest first, to a worker pool; a semaphore caps how many run at once. The tick returns once
 * its whole batch has drained, so a task that is still running is never selected again.
 *
 * <p>Per task: the task is re-read and skipped unless still {@code active}, executed with the
 * per-task timeout, and its outcome is written back as a run log, last-run fields and either a new
 * next-run, {@code completed} or {@code failed}.
 *
 * <p>Typical usage:
 * <pre>{@code
 * TaskScheduler scheduler = new PollingTaskScheduler(props, taskStore, runner, journal);
 * scheduler.start();
 * ...
 * scheduler.stop();
 * }</pre>
 */
public class PollingTaskScheduler implements TaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(PollingTaskScheduler.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final SchedulerProperties props;
    private final TaskStore taskStore;
    private final ExecutionRunner runner;
    private final RunOutputJournal journal;
    private final Clock clock;
    private final ZoneId zone;

    private final Semaphore slots;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean stopping = false;
    private volatile CountDownLatch stopSignal = new CountDownLatch(1);

    private ExecutorService workerPool;
    private Thread pollerThread;

    public PollingTaskScheduler(SchedulerProperties props, TaskStore taskStore, ExecutionRunner runner,
                                RunOutputJournal journal) {
        this(props, taskStore, runner, journal, Clock.systemUTC());
    }

    /**
     * @param journal optional; null disables the run output journal
     * @param clock   time source for due-task selection, run timestamps and rescheduling
     */
    public PollingTaskScheduler(SchedulerProperties props, TaskStore taskStore, ExecutionRunner runner,
                                RunOutputJournal journal, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.taskStore = Objects.requireNonNull(taskStore, "taskStore must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.journal = journal;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (props.getMaxConcurrentTasks() <= 0) {
            throw new IllegalArgumentException("sandcron.maxConcurrentTasks must be a positive number");
        }
        this.slots = new Semaphore(props.getMaxConcurrentTasks());
        this.zone = props.zoneId();
    }

    /**
     * Start the poller. The first poll happens one full interval after this call.
     */
    @Override
    public void start() {
        Duration interval = Objects.requireNonNull(props.getPollInterval(), "sandcron.pollInterval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("sandcron.pollInterval must be a positive duration");
        }
        Duration taskTimeout = Objects.requireNonNull(props.getTaskTimeout(), "sandcron.taskTimeout must not be null");
        if (taskTimeout.isZero() || taskTimeout.isNegative()) {
            throw new IllegalArgumentException("sandcron.taskTimeout must be a positive duration");
        }

        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("Task scheduler starting with pollInterval={}, taskTimeout={}, maxConcurrentTasks={}, timezone={}",
                interval, taskTimeout, props.getMaxConcurrentTasks(), zone);

        stopping = false;
        stopSignal = new CountDownLatch(1);
        ensureWorkerPool();

        Thread poller = new Thread(this::pollerLoop);
        poller.setName("sandcron.poller");
        poller.setDaemon(true);
        pollerThread = poller;
        poller.start();

        log.info("Task scheduler started successfully.");
    }

    /**
     * Stop ticking. Dispatched executions finish or hit their own timeout; nothing is cancelled.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Task scheduler stopping...");
        stopping = true;
        stopSignal.countDown();

        long waitMillis = props.getTaskTimeout().plus(SHUTDOWN_GRACE).toMillis();

        Thread poller = pollerThread;
        pollerThread = null;
        if (poller != null && poller != Thread.currentThread()) {
            try {
                poller.join(waitMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        ExecutorService pool;
        synchronized (this) {
            pool = workerPool;
            workerPool = null;
        }
        if (pool != null) {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(waitMillis, TimeUnit.MILLISECONDS)) {
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pool.shutdownNow();
            }
        }
        log.info("Task scheduler stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public int pollOnce() {
        if (stopping) {
            return 0;
        }

        Instant now = clock.instant();
        List<ScheduledTask> due = taskStore.listDueTasks(now);
        if (due.isEmpty()) {
            log.debug("No tasks due for execution now={}", now);
            return 0;
        }

        log.info("Found {} tasks due for execution", due.size());

        ExecutorService pool = ensureWorkerPool();
        List<Future<?>> batch = new ArrayList<>(due.size());
        try {
            for (ScheduledTask task : due) {
                if (stopping) {
                    log.info("Shutdown requested; leaving {} due tasks for a later run", due.size() - batch.size());
                    break;
                }
                slots.acquire();
                try {
                    batch.add(pool.submit(() -> runGuarded(task)));
                } catch (RejectedExecutionException e) {
                    slots.release();
                    log.warn("Worker pool rejected task taskId={}; stopping dispatch", task.id());
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for a free slot; dispatched={} of {}", batch.size(), due.size());
        }

        awaitBatch(batch);
        return batch.size();
    }

    /**
     * Current number of free concurrency slots.
     */
    int availableSlots() {
        return slots.availablePermits();
    }

    private synchronized ExecutorService ensureWorkerPool() {
        if (workerPool == null) {
            AtomicInteger threadCount = new AtomicInteger();
            workerPool = Executors.newFixedThreadPool(props.getMaxConcurrentTasks(), r -> {
                Thread t = new Thread(r);
                t.setName("sandcron.worker-" + threadCount.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }
        return workerPool;
    }

    private void pollerLoop() {
        long periodNanos = props.getPollInterval().toNanos();
        long origin = System.nanoTime();
        long nextTick = origin + periodNanos;

        while (started.get()) {
            long waitNanos = nextTick - System.nanoTime();
            try {
                if (waitNanos > 0 && stopSignal.await(waitNanos, TimeUnit.NANOSECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (!started.get()) {
                break;
            }

            try {
                pollOnce();
            } catch (Exception e) {
                log.error("Task scheduler poll failed msg={}", e.getMessage(), e);
            }

            nextTick = nextTickAfter(origin, periodNanos, System.nanoTime());
        }
    }

    /**
     * First tick boundary ({@code origin + k * period}) strictly after {@code now}; missed ticks are skipped.
     */
    static long nextTickAfter(long origin, long periodNanos, long now) {
        long elapsed = now - origin;
        if (elapsed < 0) {
            return origin;
        }
        return origin + (elapsed / periodNanos + 1) * periodNanos;
    }

    private void awaitBatch(List<Future<?>> batch) {
        for (Future<?> f : batch) {
            try {
                f.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Task execution crashed msg={}", cause.getMessage(), cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for dispatched tasks to finish");
                return;
            }
        }
    }

    private void runGuarded(ScheduledTask task) {
        try {
            executeTask(task);
        } catch (ExecutionInfrastructureException e) {
            log.error("Sandbox could not be launched taskId={} group={} msg={}",
                    task.id(), task.groupFolder(), e.getMessage(), e);
        } catch (Exception e) {
            log.error("Task execution failed unexpectedly taskId={} msg={}", task.id(), e.getMessage(), e);
            try {
                taskStore.markFailed(task.id());
            } catch (Exception storeEx) {
                log.error("markFailed failed taskId={} msg={}", task.id(), storeEx.getMessage(), storeEx);
            }
        } finally {
            slots.release();
        }
    }

    private void executeTask(ScheduledTask selected) throws ExecutionInfrastructureException {
        // may have been paused or cancelled since it was selected
        Optional<ScheduledTask> current = taskStore.getTask(selected.id());
        if (current.isEmpty()) {
            log.warn("Task {} no longer exists, skipping", selected.id());
            return;
        }
        ScheduledTask task = current.get();
        if (!task.isActive()) {
            log.info("Task {} is no longer active (status={}), skipping", task.id(), task.status());
            return;
        }

        log.info("Executing task taskId={} group={}", task.id(), task.groupFolder());

        ExecutionRequest request = ExecutionRequest.forScheduledTask(task);
        Instant runAt = clock.instant();
        ExecutionOutcome outcome = runner.run(request, props.getTaskTimeout());

        recordOutcome(task, request, runAt, outcome);
    }

    private void recordOutcome(ScheduledTask task, ExecutionRequest request, Instant runAt, ExecutionOutcome outcome) {
        ExecutionResult result = outcome.result();
        RunStatus runStatus = classify(outcome);
        String resultText = result.result();
        String errorText = errorText(runStatus, result);
        long durationMs = outcome.elapsed().toMillis();

        taskStore.appendRunLog(new TaskRunLog(task.id(), runAt, durationMs, runStatus, resultText, errorText));
        taskStore.updateLastRun(task.id(), runAt, runStatus == RunStatus.SUCCESS ? resultText : errorText);

        if (journal != null && props.isJournalEnabled()) {
            journal.record(task.groupFolder(), request.sessionId(), result, clock.instant());
        }

        log.info("Task finished taskId={} status={} duration={}",
                task.id(), runStatus.value(), DurationFormat.format(durationMs));

        TaskStatus next = TaskStatus.afterRun(runStatus == RunStatus.SUCCESS, task.isOnce());
        switch (next) {
            case FAILED -> {
                taskStore.markFailed(task.id());
                log.warn("Task marked failed taskId={} runStatus={} error={}", task.id(), runStatus.value(), errorText);
            }
            case COMPLETED -> {
                taskStore.markCompleted(task.id());
                log.info("One-time task completed taskId={}", task.id());
            }
            default -> reschedule(task);
        }
    }

    private void reschedule(ScheduledTask task) {
        Optional<Instant> nextRun = ScheduleCalculator.nextRunAfter(task, zone, clock.instant());
        if (nextRun.isPresent()) {
            taskStore.updateNextRun(task.id(), nextRun.get());
            log.debug("Task rescheduled taskId={} nextRun={}", task.id(), nextRun.get());
        } else {
            log.warn("No next run computed; task stays active until its schedule is repaired taskId={} scheduleType={} scheduleValue='{}'",
                    task.id(), task.scheduleType(), task.scheduleValue());
        }
    }

    private static RunStatus classify(ExecutionOutcome outcome) {
        if (outcome.timedOut()) {
            return RunStatus.TIMEOUT;
        }
        return outcome.result().isSuccess() ? RunStatus.SUCCESS : RunStatus.ERROR;
    }

    private String errorText(RunStatus runStatus, ExecutionResult result) {
        return switch (runStatus) {
            case SUCCESS -> result.error();
            case ERROR -> result.error() != null
                    ? result.error()
                    : "Agent reported status '" + result.status() + "'";
            case TIMEOUT -> "Task execution timed out after " + DurationFormat.format(props.getTaskTimeout().toMillis());
        };
    }
}
