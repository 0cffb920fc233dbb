package io.helmttl.cli;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.helmttl.services.ReleaseStore;

@FunctionalInterface
public interface ReleaseStoreFactory {
    ReleaseStore create(KubernetesClient client, String driver);
}
