package io.helmttl.services;

import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.PodResource;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

@Slf4j
abstract public class PodService {
    /**
     * Label the Job controller puts on the pods it creates.
     */
    public static final String JOB_NAME_LABEL = "job-name";

    /**
     * Waits until a pod owned by the job exists. A failing list call is thrown right away.
     *
     * @return the first pod found, or empty if none appeared before the deadline
     */
    public static Optional<Pod> waitForJobPod(KubernetesClient client, Poller poller, String namespace, String jobName, Instant deadline) throws InterruptedException {
        return poller.until(deadline, () -> {
            PodList pods = client.pods()
                .inNamespace(namespace)
                .withLabel(JOB_NAME_LABEL, jobName)
                .list();

            if (pods.getItems().isEmpty()) {
                log.debug("No pod yet for job '{}' in namespace '{}'", jobName, namespace);
                return Optional.empty();
            }

            return Optional.of(pods.getItems().get(0));
        });
    }

    /**
     * Waits until the container, init or main, reports a terminated state.
     *
     * @return the exit code, or empty if the container was still running at the deadline
     * @throws IllegalStateException if the pod disappeared
     */
    public static Optional<Integer> waitForContainerTermination(KubernetesClient client, Poller poller, Pod pod, String container, Instant deadline) throws InterruptedException {
        PodResource podResource = podRef(client, pod);

        return poller.until(deadline, () -> {
            Pod current = podResource.get();
            if (current == null) {
                throw new IllegalStateException("Pod '" + pod.getMetadata().getName() + "' no longer exists");
            }

            Optional<Integer> exitCode = statuses(current)
                .filter(status -> container.equals(status.getName()))
                .filter(status -> status.getState() != null && status.getState().getTerminated() != null)
                .map(status -> status.getState().getTerminated().getExitCode())
                .findFirst();

            if (exitCode.isEmpty()) {
                log.debug("Container '{}' of pod '{}' is not terminated yet", container, pod.getMetadata().getName());
            }

            return exitCode;
        });
    }

    /**
     * @return init container names followed by container names, as declared by the actual pod so that injected
     * sidecars are included
     */
    public static List<String> containerNames(Pod pod) {
        List<String> names = new ArrayList<>();

        if (pod.getSpec() != null) {
            if (pod.getSpec().getInitContainers() != null) {
                pod.getSpec().getInitContainers().forEach(container -> names.add(container.getName()));
            }

            if (pod.getSpec().getContainers() != null) {
                pod.getSpec().getContainers().forEach(container -> names.add(container.getName()));
            }
        }

        return names;
    }

    public static PodResource podRef(KubernetesClient client, Pod pod) {
        return client.pods()
            .inNamespace(pod.getMetadata().getNamespace())
            .withName(pod.getMetadata().getName());
    }

    private static Stream<ContainerStatus> statuses(Pod pod) {
        if (pod.getStatus() == null) {
            return Stream.empty();
        }

        return Stream.concat(
            pod.getStatus().getInitContainerStatuses() == null ? Stream.empty() : pod.getStatus().getInitContainerStatuses().stream(),
            pod.getStatus().getContainerStatuses() == null ? Stream.empty() : pod.getStatus().getContainerStatuses().stream()
        );
    }
}
