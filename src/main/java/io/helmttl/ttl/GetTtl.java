package io.helmttl.ttl;

import com.google.common.base.Strings;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.helmttl.RunnableTask;
import io.helmttl.exceptions.KubernetesOperationException;
import io.helmttl.exceptions.TtlNotFoundException;
import io.helmttl.models.Labels;
import io.helmttl.models.TtlInfo;
import io.helmttl.services.ScheduleService;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Reads back the TTL of a release.
 */
@SuperBuilder
@ToString
@EqualsAndHashCode
@Getter
@NoArgsConstructor
@Slf4j
public class GetTtl extends AbstractTtl implements RunnableTask<GetTtl.Output> {
    /**
     * The zone used to decode schedules of CronJobs that don't declare one.
     */
    @Builder.Default
    private ZoneId timeZone = ZoneId.of("UTC");

    @Builder.Default
    private Clock clock = Clock.systemUTC();

    @Override
    public GetTtl.Output run() throws Exception {
        try (KubernetesClient client = this.client()) {
            return this.run(client);
        }
    }

    public GetTtl.Output run(KubernetesClient client) {
        String name = this.resourceName();
        String cronjobNamespace = this.cronjobNamespace();

        CronJob cronJob;
        try {
            cronJob = client.batch().v1().cronjobs().inNamespace(cronjobNamespace).withName(name).get();
        } catch (KubernetesClientException e) {
            throw new KubernetesOperationException("failed to get CronJob", e);
        }

        if (cronJob == null) {
            throw new TtlNotFoundException(this.releaseName);
        }

        ZonedDateTime scheduled = ScheduleService.parseSchedule(
            cronJob.getSpec().getSchedule(),
            ZonedDateTime.now(this.clock).withZoneSameInstant(zone(cronJob))
        );

        return Output.builder()
            .ttl(TtlInfo.builder()
                .releaseName(this.releaseName)
                .releaseNamespace(this.releaseNamespace)
                .cronjobNamespace(cronjobNamespace)
                .scheduledDate(ScheduleService.formatScheduledDate(scheduled))
                .cronSchedule(cronJob.getSpec().getSchedule())
                .deleteNamespace(Labels.deleteNamespace(cronJob.getMetadata().getLabels()))
                .build()
            )
            .build();
    }

    private ZoneId zone(CronJob cronJob) {
        String declared = cronJob.getSpec().getTimeZone();
        if (Strings.isNullOrEmpty(declared)) {
            return this.timeZone;
        }

        try {
            return ZoneId.of(declared);
        } catch (DateTimeException e) {
            log.warn("CronJob '{}' declares an unknown time zone '{}', using {}", cronJob.getMetadata().getName(), declared, this.timeZone, e);
            return this.timeZone;
        }
    }

    @Builder
    @Getter
    public static class Output {
        private final TtlInfo ttl;
    }
}
