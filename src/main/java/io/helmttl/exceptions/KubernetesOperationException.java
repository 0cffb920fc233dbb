package io.helmttl.exceptions;

/**
 * A call to the Kubernetes API failed for another reason than the object being absent.
 * The message names the operation that was attempted, the cause holds the client error.
 */
public class KubernetesOperationException extends TtlException {
    public KubernetesOperationException(String operation, Throwable cause) {
        super(operation + ": " + cause.getMessage(), cause);
    }
}
