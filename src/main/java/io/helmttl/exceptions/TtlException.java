package io.helmttl.exceptions;

/**
 * Base class of every error raised by helm-ttl operations.
 */
public class TtlException extends RuntimeException {
    public TtlException(String message) {
        super(message);
    }

    public TtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
