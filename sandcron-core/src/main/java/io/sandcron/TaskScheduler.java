package io.sandcron;

/**
 * Scheduler loop API.
 *
 * <p>Polls a {@link TaskStore} for due tasks on a fixed cadence and runs each one through an
 * {@link ExecutionRunner} under a concurrency ceiling, then records the outcome and reschedules.
 */
public interface TaskScheduler {

    /**
     * Start ticking. The first poll happens one full poll interval after start. Idempotent.
     */
    void start();

    /**
     * Stop issuing ticks and dispatches. In-flight executions run to completion or to their own
     * timeout before this returns. Idempotent.
     */
    void stop();

    boolean isRunning();

    /**
     * Run one poll cycle on the calling thread: select due tasks, dispatch them and wait for the
     * batch to drain.
     *
     * @return number of tasks dispatched
     */
    int pollOnce();
}
