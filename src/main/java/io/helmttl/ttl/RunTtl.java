package io.helmttl.ttl;

import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.helmttl.RunnableTask;
import io.helmttl.exceptions.KubernetesOperationException;
import io.helmttl.exceptions.RunFailedException;
import io.helmttl.exceptions.TtlException;
import io.helmttl.exceptions.TtlNotFoundException;
import io.helmttl.models.ContainerResult;
import io.helmttl.models.Labels;
import io.helmttl.models.RunResult;
import io.helmttl.services.CronJobService;
import io.helmttl.services.LogFetcher;
import io.helmttl.services.LoggingOutputStream;
import io.helmttl.services.PodLogService;
import io.helmttl.services.PodService;
import io.helmttl.services.Poller;
import io.helmttl.services.RbacService;
import io.helmttl.services.ResourceNameService;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.slf4j.Slf4j;

import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Runs the TTL of a release right away, from the CronJob template, and waits for it to complete.
 * <p>
 * Once the Job is created, the cleanup always happens, whatever the outcome of the Job: the Job, the CronJob,
 * the service account and RBAC objects and, when the TTL says so, the release namespace are deleted.
 */
@SuperBuilder
@ToString
@EqualsAndHashCode
@Getter
@NoArgsConstructor
@Slf4j
public class RunTtl extends AbstractTtl implements RunnableTask<RunTtl.Output> {
    @Builder.Default
    private Poller poller = Poller.every(Duration.ofSeconds(1));

    @Override
    public RunTtl.Output run() throws Exception {
        try (
            KubernetesClient client = this.client();
            LoggingOutputStream logs = new LoggingOutputStream(log, "[container]")
        ) {
            return this.run(client, logs, PodLogService.fetcher(client));
        }
    }

    /**
     * @param logSink    receives the logs of every container, each preceded by a header
     * @param logFetcher reads the log of one container
     * @throws RunFailedException if the Job didn't complete cleanly, carrying everything gathered so far
     */
    public RunTtl.Output run(KubernetesClient client, OutputStream logSink, LogFetcher logFetcher) {
        String name = this.resourceName();
        String namespace = this.cronjobNamespace();

        CronJob cronJob;
        try {
            cronJob = client.batch().v1().cronjobs().inNamespace(namespace).withName(name).get();
        } catch (KubernetesClientException e) {
            throw new KubernetesOperationException("failed to get CronJob", e);
        }

        if (cronJob == null) {
            throw new TtlNotFoundException(this.releaseName);
        }

        boolean deleteNamespace = Labels.deleteNamespace(cronJob.getMetadata().getLabels());
        String jobName = ResourceNameService.runName(name);
        Job job = CronJobService.buildJob(cronJob, jobName);

        try {
            client.batch().v1().jobs().inNamespace(namespace).resource(job).create();
        } catch (KubernetesClientException e) {
            throw new KubernetesOperationException("failed to create Job", e);
        }

        log.info("Job '{}' is created in namespace '{}'", jobName, namespace);

        RunResult.RunResultBuilder result = RunResult.builder()
            .releaseName(this.releaseName)
            .releaseNamespace(this.releaseNamespace);

        RunFailedException error = null;
        try {
            this.watch(client, logSink, logFetcher, namespace, jobName, result);
        } catch (RunFailedException e) {
            error = e;
        }

        RunFailedException cleanupError = this.cleanup(client, namespace, name, jobName, deleteNamespace, result);
        if (error == null) {
            error = cleanupError;
        }

        RunResult runResult = result.build();

        if (error != null && error.getCause() instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }

        if (error == null && runResult.isJobFailed()) {
            error = new RunFailedException(
                RunFailedException.Reason.JOB_FAILED,
                "job failed: one or more containers exited with non-zero status"
            );
        }

        if (error != null) {
            throw error.withResult(runResult);
        }

        log.info("TTL of release '{}' in namespace '{}' has run", this.releaseName, this.releaseNamespace);

        return Output.builder()
            .result(runResult)
            .build();
    }

    private void watch(KubernetesClient client, OutputStream logSink, LogFetcher logFetcher, String namespace, String jobName, RunResult.RunResultBuilder result) {
        try {
            Pod pod = this.waitForPod(client, namespace, jobName);
            log.debug("Pod '{}' found for job '{}'", pod.getMetadata().getName(), jobName);

            // all the containers share the same budget
            Instant deadline = this.poller.deadline(this.waitRunning);

            for (String container : PodService.containerNames(pod)) {
                int exitCode = this.waitForContainer(client, pod, container, deadline);

                PodLogService.streamContainerLogs(logFetcher, logSink, namespace, pod.getMetadata().getName(), container);

                result.containerResult(ContainerResult.of(container, exitCode));

                if (exitCode != 0) {
                    log.warn("Container '{}' of job '{}' exited with code {}", container, jobName, exitCode);
                    result.jobFailed(true);
                } else {
                    log.debug("Container '{}' of job '{}' succeeded", container, jobName);
                }
            }
        } catch (KubernetesClientException | IllegalStateException e) {
            throw new RunFailedException(
                RunFailedException.Reason.CLUSTER_ERROR,
                "failed while watching job '" + jobName + "': " + e.getMessage(),
                e
            );
        }
    }

    private Pod waitForPod(KubernetesClient client, String namespace, String jobName) {
        Optional<Pod> pod;
        try {
            pod = PodService.waitForJobPod(client, this.poller, namespace, jobName, this.poller.deadline(this.waitUntilRunning));
        } catch (InterruptedException e) {
            throw new RunFailedException(
                RunFailedException.Reason.POD_WAIT_TIMEOUT,
                "interrupted while waiting for pod of job '" + jobName + "'",
                e
            );
        }

        return pod.orElseThrow(() -> new RunFailedException(
            RunFailedException.Reason.POD_WAIT_TIMEOUT,
            "timed out waiting for pod of job '" + jobName + "' after " + this.waitUntilRunning
        ));
    }

    private int waitForContainer(KubernetesClient client, Pod pod, String container, Instant deadline) {
        Optional<Integer> exitCode;
        try {
            exitCode = PodService.waitForContainerTermination(client, this.poller, pod, container, deadline);
        } catch (InterruptedException e) {
            throw new RunFailedException(
                RunFailedException.Reason.CONTAINER_WAIT_TIMEOUT,
                "interrupted while waiting for container '" + container + "'",
                e
            );
        }

        return exitCode.orElseThrow(() -> new RunFailedException(
            RunFailedException.Reason.CONTAINER_WAIT_TIMEOUT,
            "timed out waiting for container '" + container + "' after " + this.waitRunning
        ));
    }

    /**
     * @return the error to report if the CronJob survived, since it would fire again
     */
    private RunFailedException cleanup(KubernetesClient client, String namespace, String name, String jobName, boolean deleteNamespace, RunResult.RunResultBuilder result) {
        bestEffort("delete job '" + jobName + "'", () -> client.batch().v1().jobs()
            .inNamespace(namespace)
            .withName(jobName)
            .withPropagationPolicy(DeletionPropagation.BACKGROUND)
            .delete()
        );

        RunFailedException cronJobError = null;
        try {
            client.batch().v1().cronjobs().inNamespace(namespace).withName(name).delete();
            log.info("CronJob '{}' is deleted from namespace '{}'", name, namespace);
        } catch (KubernetesClientException e) {
            if (e.getCode() != HttpURLConnection.HTTP_NOT_FOUND) {
                log.warn("Unable to delete CronJob '{}' in namespace '{}'", name, namespace, e);
                cronJobError = new RunFailedException(
                    RunFailedException.Reason.CRONJOB_NOT_DELETED,
                    "failed to delete CronJob '" + name + "', it will fire again: " + e.getMessage(),
                    e
                );
            }
        }

        bestEffort(
            "delete service account and RBAC",
            () -> RbacService.teardown(client, this.releaseName, this.releaseNamespace, namespace)
        );

        if (deleteNamespace) {
            try {
                client.namespaces().withName(this.releaseNamespace).delete();
                log.info("Namespace '{}' is deleted", this.releaseNamespace);
                result.deletedNamespace(true);
            } catch (KubernetesClientException e) {
                if (e.getCode() == HttpURLConnection.HTTP_NOT_FOUND) {
                    result.deletedNamespace(true);
                } else {
                    log.warn("Unable to delete namespace '{}'", this.releaseNamespace, e);
                }
            }
        }

        return cronJobError;
    }

    private static void bestEffort(String what, Runnable action) {
        try {
            action.run();
        } catch (KubernetesClientException | TtlException e) {
            log.warn("Unable to {}", what, e);
        }
    }

    @Builder
    @Getter
    public static class Output {
        private final RunResult result;
    }
}
