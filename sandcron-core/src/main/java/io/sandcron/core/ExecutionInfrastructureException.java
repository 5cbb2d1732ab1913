package io.sandcron.core;

/**
 * The sandbox could not be prepared or launched: nothing was executed.
 *
 * <p>Distinct from an execution that ran and failed, which is reported as an {@link ExecutionResult}.
 */
public class ExecutionInfrastructureException extends Exception {

    public ExecutionInfrastructureException(String message) {
        super(message);
    }

    public ExecutionInfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
