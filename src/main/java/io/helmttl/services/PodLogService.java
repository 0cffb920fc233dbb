package io.helmttl.services;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

@Slf4j
abstract public class PodLogService {
    /**
     * @return a {@link LogFetcher} reading the logs through the Kubernetes API
     */
    public static LogFetcher fetcher(KubernetesClient client) {
        return (namespace, podName, containerName) -> client.pods()
            .inNamespace(namespace)
            .withName(podName)
            .inContainer(containerName)
            .getLogInputStream();
    }

    public static String header(String containerName) {
        return "==> Container: " + containerName + " <==\n";
    }

    /**
     * Writes a header then the whole log of the container to {@code output}.
     *
     * @return {@code false} if the log could not be fetched or copied, the failure is logged
     */
    public static boolean streamContainerLogs(LogFetcher logFetcher, OutputStream output, String namespace, String podName, String containerName) {
        try {
            output.write(header(containerName).getBytes(StandardCharsets.UTF_8));

            try (InputStream logs = logFetcher.fetch(namespace, podName, containerName)) {
                if (logs != null) {
                    logs.transferTo(output);
                }
            }

            output.flush();
            return true;
        } catch (IOException | KubernetesClientException e) {
            log.warn("Unable to stream logs of container '{}' in pod '{}': {}", containerName, podName, e.getMessage(), e);
            return false;
        }
    }
}
