package io.helmttl.exceptions;

import lombok.Getter;

/**
 * Raised when the caller input can never be satisfied. Always thrown before anything is written to the cluster.
 */
@Getter
public class ValidationException extends TtlException {
    public enum Reason {
        NAME_TOO_LONG,
        NAMESPACE_CONFLICT,
        INVALID_DURATION,
        INVALID_SCHEDULE
    }

    private final Reason reason;

    public ValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ValidationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
