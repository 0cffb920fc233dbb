package io.helmttl.cli;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.helmttl.models.Connection;

import java.io.IOException;

@FunctionalInterface
public interface ClientFactory {
    /**
     * @return a new client, closed by the caller
     */
    KubernetesClient create(Connection connection) throws IOException;
}
