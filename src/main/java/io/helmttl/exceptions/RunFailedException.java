package io.helmttl.exceptions;

import io.helmttl.models.RunResult;
import lombok.Getter;

/**
 * A synchronous run did not complete cleanly. The cleanup phase has already been executed when this is thrown,
 * and {@link #getResult()} holds everything gathered before the failure.
 */
@Getter
public class RunFailedException extends TtlException {
    public enum Reason {
        POD_WAIT_TIMEOUT,
        CONTAINER_WAIT_TIMEOUT,
        CLUSTER_ERROR,
        CRONJOB_NOT_DELETED,
        JOB_FAILED
    }

    private final Reason reason;

    private RunResult result;

    public RunFailedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RunFailedException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public RunFailedException withResult(RunResult result) {
        this.result = result;
        return this;
    }
}
