package io.helmttl.ttl;

import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.helmttl.RunnableTask;
import io.helmttl.exceptions.KubernetesOperationException;
import io.helmttl.exceptions.ReleaseNotFoundException;
import io.helmttl.exceptions.ServiceAccountNotFoundException;
import io.helmttl.exceptions.ValidationException;
import io.helmttl.models.CronJobOptions;
import io.helmttl.services.CronJobService;
import io.helmttl.services.HelmReleaseStore;
import io.helmttl.services.RbacService;
import io.helmttl.services.ReleaseStore;
import io.helmttl.services.ScheduleService;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.HashMap;

/**
 * Schedules the uninstall of a release. Running it again for the same release moves the schedule and keeps a single
 * CronJob.
 */
@SuperBuilder
@ToString
@EqualsAndHashCode
@Getter
@NoArgsConstructor
@Slf4j
public class SetTtl extends AbstractTtl implements RunnableTask<SetTtl.Output> {
    /**
     * When to uninstall: {@code 30m}, {@code 7d}, {@code 2 weeks}, {@code tomorrow}, {@code next friday at 6pm}...
     */
    private String duration;

    /**
     * The service account running the uninstall, in the CronJob namespace.
     * With {@link #createServiceAccount}, {@code default} means a service account named after the CronJob.
     */
    @Builder.Default
    private String serviceAccount = "default";

    /**
     * Create the service account and the RBAC objects needed by the uninstall.
     */
    @Builder.Default
    private boolean createServiceAccount = false;

    /**
     * Image running {@code helm uninstall}, the bundled default when empty.
     */
    private String helmImage;

    /**
     * Image running {@code kubectl}, the bundled default when empty.
     */
    private String kubectlImage;

    /**
     * Also delete the release namespace. Requires the CronJob to live in another namespace.
     */
    @Builder.Default
    private boolean deleteNamespace = false;

    /**
     * The Helm storage driver holding the release records.
     */
    @Builder.Default
    private String driver = HelmReleaseStore.DEFAULT_DRIVER;

    /**
     * The zone the schedule is expressed in, written to the CronJob.
     */
    @Builder.Default
    private ZoneId timeZone = ZoneId.of("UTC");

    @Builder.Default
    private Clock clock = Clock.systemUTC();

    @Override
    public SetTtl.Output run() throws Exception {
        try (KubernetesClient client = this.client()) {
            return this.run(client, new HelmReleaseStore(client, this.driver));
        }
    }

    public SetTtl.Output run(KubernetesClient client, ReleaseStore releaseStore) {
        String cronjobNamespace = this.cronjobNamespace();

        if (!releaseStore.exists(this.releaseName, this.releaseNamespace)) {
            throw new ReleaseNotFoundException(this.releaseName);
        }

        if (this.deleteNamespace && this.releaseNamespace.equals(cronjobNamespace)) {
            throw new ValidationException(
                ValidationException.Reason.NAMESPACE_CONFLICT,
                "cannot use --delete-namespace when CronJob namespace (" + cronjobNamespace + ") equals release namespace (" + this.releaseNamespace + ")"
            );
        }

        ZonedDateTime target = ScheduleService.parseTimeInput(this.duration, ZonedDateTime.now(this.clock).withZoneSameInstant(this.timeZone));
        String schedule = ScheduleService.timeToSchedule(target);
        String name = this.resourceName();

        String serviceAccountName = this.serviceAccount;
        if (this.createServiceAccount && "default".equals(serviceAccountName)) {
            serviceAccountName = name;
        }

        if (this.createServiceAccount) {
            try {
                RbacService.provision(client, this.releaseName, this.releaseNamespace, cronjobNamespace, serviceAccountName, this.deleteNamespace);
            } catch (KubernetesOperationException e) {
                throw new KubernetesOperationException("failed to create service account and RBAC", e);
            }
        } else {
            checkServiceAccount(client, serviceAccountName, cronjobNamespace);
        }

        CronJob cronJob = CronJobService.buildCronJob(CronJobOptions.builder()
            .releaseName(this.releaseName)
            .releaseNamespace(this.releaseNamespace)
            .cronjobNamespace(cronjobNamespace)
            .schedule(schedule)
            .timeZone(this.timeZone.getId())
            .serviceAccount(serviceAccountName)
            .helmImage(this.helmImage)
            .kubectlImage(this.kubectlImage)
            .deleteNamespace(this.deleteNamespace)
            .build()
        );

        createOrUpdate(client, cronJob);

        log.info(
            "TTL set for release '{}' in namespace '{}': CronJob '{}' in namespace '{}' fires at {}",
            this.releaseName,
            this.releaseNamespace,
            name,
            cronjobNamespace,
            ScheduleService.formatScheduledDate(target)
        );

        return Output.builder()
            .cronJobName(name)
            .cronjobNamespace(cronjobNamespace)
            .schedule(schedule)
            .scheduledDate(target)
            .serviceAccount(serviceAccountName)
            .build();
    }

    private static void checkServiceAccount(KubernetesClient client, String name, String namespace) {
        try {
            if (client.serviceAccounts().inNamespace(namespace).withName(name).get() == null) {
                throw new ServiceAccountNotFoundException(name, namespace);
            }
        } catch (KubernetesClientException e) {
            throw new KubernetesOperationException("failed to check service account", e);
        }
    }

    private static void createOrUpdate(KubernetesClient client, CronJob cronJob) {
        String namespace = cronJob.getMetadata().getNamespace();
        String name = cronJob.getMetadata().getName();

        CronJob existing;
        try {
            existing = client.batch().v1().cronjobs().inNamespace(namespace).withName(name).get();
        } catch (KubernetesClientException e) {
            throw new KubernetesOperationException("failed to check existing CronJob", e);
        }

        if (existing == null) {
            try {
                client.batch().v1().cronjobs().inNamespace(namespace).resource(cronJob).create();
                log.debug("CronJob '{}' is created in namespace '{}'", name, namespace);
            } catch (KubernetesClientException e) {
                throw new KubernetesOperationException("failed to create CronJob", e);
            }
            return;
        }

        existing.setSpec(cronJob.getSpec());
        existing.getMetadata().setLabels(new HashMap<>(cronJob.getMetadata().getLabels()));

        try {
            client.batch().v1().cronjobs().inNamespace(namespace).resource(existing).update();
            log.debug("CronJob '{}' is updated in namespace '{}'", name, namespace);
        } catch (KubernetesClientException e) {
            throw new KubernetesOperationException("failed to update CronJob", e);
        }
    }

    @Builder
    @Getter
    public static class Output {
        private final String cronJobName;

        private final String cronjobNamespace;

        private final String schedule;

        private final ZonedDateTime scheduledDate;

        private final String serviceAccount;
    }
}
