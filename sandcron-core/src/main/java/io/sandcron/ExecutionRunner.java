package io.sandcron;

import io.sandcron.core.ExecutionInfrastructureException;
import io.sandcron.core.ExecutionOutcome;
import io.sandcron.core.ExecutionRequest;

import java.time.Duration;

/**
 * Runs one request inside an isolated subprocess.
 */
public interface ExecutionRunner {

    /**
     * Launch the sandbox, feed it the request and wait for it, at most {@code timeout}.
     *
     * <p>A subprocess that fails or times out is reported through the returned outcome.
     *
     * @throws ExecutionInfrastructureException if the sandbox could not be prepared or spawned
     */
    ExecutionOutcome run(ExecutionRequest request, Duration timeout) throws ExecutionInfrastructureException;
}
