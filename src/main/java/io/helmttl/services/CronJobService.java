package io.helmttl.services;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Resources;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.api.model.batch.v1.CronJobBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.JobSpec;
import io.fabric8.kubernetes.client.utils.KubernetesSerialization;
import io.helmttl.exceptions.ValidationException;
import io.helmttl.models.CronJobOptions;
import io.helmttl.models.Labels;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the TTL CronJob and the one-shot Job derived from it.
 */
@Slf4j
abstract public class CronJobService {
    public static final String HELM_UNINSTALL_CONTAINER_NAME = "helm-uninstall";
    public static final String DELETE_NAMESPACE_CONTAINER_NAME = "delete-namespace";
    public static final String SELF_CLEANUP_CONTAINER_NAME = "self-cleanup";

    public static final String TRIGGERED_BY_RUN = "run";
    public static final List<String> RUN_CLEANUP_COMMAND = List.of("echo", "cleanup handled by helm-ttl run");

    public static final String DEFAULT_HELM_IMAGE = defaultImage("dockerfiles/helm/Dockerfile", "alpine/helm:latest");
    public static final String DEFAULT_KUBECTL_IMAGE = defaultImage("dockerfiles/kubectl/Dockerfile", "alpine/k8s:latest");

    private static final KubernetesSerialization SERIALIZATION = new KubernetesSerialization();

    /**
     * Builds a CronJob whose init containers uninstall the release (and delete its namespace when requested)
     * and whose main container deletes the CronJob itself.
     *
     * @throws ValidationException if the namespace must be deleted from inside itself, or the name is too long
     */
    public static CronJob buildCronJob(CronJobOptions options) {
        if (options.isDeleteNamespace() && options.getReleaseNamespace().equals(options.getCronjobNamespace())) {
            throw new ValidationException(
                ValidationException.Reason.NAMESPACE_CONFLICT,
                "cannot use --delete-namespace when CronJob namespace (" + options.getCronjobNamespace() + ") " +
                    "equals release namespace (" + options.getReleaseNamespace() + "); the CronJob would delete its own namespace"
            );
        }

        String name = ResourceNameService.resourceName(options.getReleaseName(), options.getReleaseNamespace());
        String helmImage = Strings.isNullOrEmpty(options.getHelmImage()) ? DEFAULT_HELM_IMAGE : options.getHelmImage();
        String kubectlImage = Strings.isNullOrEmpty(options.getKubectlImage()) ? DEFAULT_KUBECTL_IMAGE : options.getKubectlImage();

        Map<String, String> labels = Labels.of(
            options.getReleaseName(),
            options.getReleaseNamespace(),
            options.getCronjobNamespace(),
            options.isDeleteNamespace()
        );

        List<Container> initContainers = new ArrayList<>();
        initContainers.add(new ContainerBuilder()
            .withName(HELM_UNINSTALL_CONTAINER_NAME)
            .withImage(helmImage)
            .withCommand("helm", "uninstall", options.getReleaseName(), "--namespace", options.getReleaseNamespace())
            .build()
        );

        if (options.isDeleteNamespace()) {
            initContainers.add(new ContainerBuilder()
                .withName(DELETE_NAMESPACE_CONTAINER_NAME)
                .withImage(kubectlImage)
                .withCommand("kubectl", "delete", "namespace", options.getReleaseNamespace())
                .build()
            );
        }

        Container selfCleanup = new ContainerBuilder()
            .withName(SELF_CLEANUP_CONTAINER_NAME)
            .withImage(kubectlImage)
            .withCommand("kubectl", "delete", "cronjob", name, "--namespace", options.getCronjobNamespace())
            .build();

        return new CronJobBuilder()
            .withNewMetadata()
                .withName(name)
                .withNamespace(options.getCronjobNamespace())
                .withLabels(labels)
            .endMetadata()
            .withNewSpec()
                .withSchedule(options.getSchedule())
                .withTimeZone(options.getTimeZone())
                .withConcurrencyPolicy("Forbid")
                .withFailedJobsHistoryLimit(0)
                .withSuccessfulJobsHistoryLimit(1)
                .withNewJobTemplate()
                    .withNewMetadata()
                        .withLabels(labels)
                    .endMetadata()
                    .withNewSpec()
                        .withBackoffLimit(0)
                        .withNewTemplate()
                            .withNewMetadata()
                                .withLabels(labels)
                            .endMetadata()
                            .withNewSpec()
                                .withServiceAccountName(options.getServiceAccount())
                                .withRestartPolicy("Never")
                                .withInitContainers(initContainers)
                                .withContainers(selfCleanup)
                            .endSpec()
                        .endTemplate()
                    .endSpec()
                .endJobTemplate()
            .endSpec()
            .build();
    }

    /**
     * Builds a Job from the CronJob template, to be run right away. The self-cleanup container becomes a no-op,
     * the caller is in charge of the cleanup. The CronJob is left untouched.
     */
    public static Job buildJob(CronJob cronJob, String jobName) {
        JobSpec spec = SERIALIZATION.clone(cronJob.getSpec().getJobTemplate().getSpec());

        if (spec.getTemplate() != null && spec.getTemplate().getSpec() != null && spec.getTemplate().getSpec().getContainers() != null) {
            spec.getTemplate().getSpec().setContainers(
                spec.getTemplate().getSpec().getContainers()
                    .stream()
                    .map(container -> SELF_CLEANUP_CONTAINER_NAME.equals(container.getName()) ?
                        new ContainerBuilder(container).withCommand(RUN_CLEANUP_COMMAND).build() :
                        container
                    )
                    .collect(Collectors.toList())
            );
        }

        Map<String, String> labels = new HashMap<>();
        if (cronJob.getMetadata().getLabels() != null) {
            labels.putAll(cronJob.getMetadata().getLabels());
        }
        labels.put(Labels.TRIGGERED_BY, TRIGGERED_BY_RUN);

        return new JobBuilder()
            .withNewMetadata()
                .withName(jobName)
                .withNamespace(cronJob.getMetadata().getNamespace())
                .withLabels(ImmutableMap.copyOf(labels))
            .endMetadata()
            .withSpec(spec)
            .build();
    }

    @VisibleForTesting
    static String parseImageFromDockerfile(String content) {
        return content.lines()
            .map(String::trim)
            .filter(line -> line.toUpperCase(Locale.ROOT).startsWith("FROM "))
            .map(line -> line.substring(5).trim())
            .findFirst()
            .orElse("");
    }

    private static String defaultImage(String resource, String fallback) {
        try {
            URL url = Resources.getResource(resource);
            String image = parseImageFromDockerfile(Resources.toString(url, StandardCharsets.UTF_8));

            return image.isEmpty() ? fallback : image;
        } catch (IllegalArgumentException | IOException e) {
            log.debug("Unable to read default image from '{}', using '{}'", resource, fallback, e);
            return fallback;
        }
    }
}
