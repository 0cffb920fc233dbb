package io.helmttl.services;

/**
 * Where Helm keeps the release records.
 */
@FunctionalInterface
public interface ReleaseStore {
    /**
     * @return {@code true} if at least one revision of the release is recorded in the namespace
     * @throws io.helmttl.exceptions.KubernetesOperationException if the store can't be read
     */
    boolean exists(String releaseName, String namespace);
}
