package io.helmttl;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.helmttl.models.Connection;
import io.helmttl.services.ClientService;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.io.IOException;
import java.time.Duration;

@SuperBuilder
@ToString
@EqualsAndHashCode
@Getter
@NoArgsConstructor
public abstract class AbstractConnection {
    /**
     * The connection parameters to the Kubernetes cluster.
     * <p>
     * If no connection is defined, we try to load the connection from the current context in the following order:
     * system properties, environment variables, kube config file, service account token and a mounted CA certificate.
     */
    private Connection connection;

    /**
     * The maximum duration to wait until the pod of a job is created. This covers scheduling the job, pulling the
     * images and starting the pod.
     */
    @Builder.Default
    protected final Duration waitUntilRunning = Duration.ofMinutes(10);

    /**
     * The maximum duration to wait for the job completion.
     */
    @Builder.Default
    protected final Duration waitRunning = Duration.ofHours(1);

    protected KubernetesClient client() throws IOException {
        return ClientService.of(connection);
    }
}
