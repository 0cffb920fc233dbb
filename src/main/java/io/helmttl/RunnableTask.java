package io.helmttl;

/**
 * An operation configured through its builder, run against the cluster its connection points to.
 *
 * @param <T> what the operation returns
 */
public interface RunnableTask<T> {
    T run() throws Exception;
}
