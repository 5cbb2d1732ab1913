package io.sandcron.core;

import java.time.Duration;
import java.util.Objects;

/**
 * What an {@link io.sandcron.ExecutionRunner} returns for one call.
 *
 * @param result   parsed result (for a timeout: parsed from the partial capture with a failed exit)
 * @param elapsed  wall-clock time from spawn to completion or termination
 * @param timedOut true when the execution budget elapsed and the subprocess was terminated
 */
public record ExecutionOutcome(ExecutionResult result, Duration elapsed, boolean timedOut) {
    public ExecutionOutcome {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }
}
