package io.helmttl.services;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.helmttl.models.Connection;

import java.io.IOException;

abstract public class ClientService {
    /**
     * Creates a {@link KubernetesClient} pre-configured from the cluster configuration,
     * loading the in-cluster config, including:
     * 1. System properties
     * 2. Environment variables
     * 3. Kube config file
     * 4. Service account token and a mounted CA certificate
     *
     * @return {@link KubernetesClient} configured from the cluster configuration
     */
    public static KubernetesClient of() {
        return new KubernetesClientBuilder().build();
    }

    /**
     * Creates a {@link KubernetesClient} from a {@link Config}.
     *
     * @param config The {@link Config} to configure the builder from.
     * @return {@link KubernetesClient} configured from the provided {@link Config}
     */
    public static KubernetesClient of(Config config) {
        return new KubernetesClientBuilder().withConfig(config).build();
    }

    public static KubernetesClient of(Connection connection) throws IOException {
        return connection != null ? of(connection.toConfig()) : of();
    }
}
