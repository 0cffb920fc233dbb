package io.helmttl.services;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.helmttl.exceptions.ValidationException;
import io.helmttl.models.CronJobOptions;
import io.helmttl.models.Labels;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CronJobServiceTest {
    private static CronJobOptions.CronJobOptionsBuilder options() {
        return CronJobOptions.builder()
            .releaseName("myapp")
            .releaseNamespace("staging")
            .cronjobNamespace("staging")
            .schedule("30 14 15 6 *")
            .timeZone("UTC")
            .serviceAccount("default");
    }

    @Test
    void buildCronJob() {
        CronJob cronJob = CronJobService.buildCronJob(options().build());

        assertThat(cronJob.getMetadata().getName(), is("myapp-staging-ttl"));
        assertThat(cronJob.getMetadata().getNamespace(), is("staging"));
        assertThat(cronJob.getMetadata().getLabels(), hasEntry(Labels.MANAGED_BY, "helm-ttl"));
        assertThat(cronJob.getMetadata().getLabels(), hasEntry(Labels.RELEASE, "myapp"));
        assertThat(cronJob.getMetadata().getLabels(), hasEntry(Labels.RELEASE_NAMESPACE, "staging"));
        assertThat(cronJob.getMetadata().getLabels(), hasEntry(Labels.CRONJOB_NAMESPACE, "staging"));
        assertThat(cronJob.getMetadata().getLabels(), hasEntry(Labels.DELETE_NAMESPACE, "false"));

        assertThat(cronJob.getSpec().getSchedule(), is("30 14 15 6 *"));
        assertThat(cronJob.getSpec().getTimeZone(), is("UTC"));
        assertThat(cronJob.getSpec().getConcurrencyPolicy(), is("Forbid"));
        assertThat(cronJob.getSpec().getFailedJobsHistoryLimit(), is(0));
        assertThat(cronJob.getSpec().getSuccessfulJobsHistoryLimit(), is(1));
        assertThat(cronJob.getSpec().getJobTemplate().getSpec().getBackoffLimit(), is(0));
        assertThat(cronJob.getSpec().getJobTemplate().getMetadata().getLabels(), is(cronJob.getMetadata().getLabels()));
        assertThat(cronJob.getSpec().getJobTemplate().getSpec().getTemplate().getMetadata().getLabels(), is(cronJob.getMetadata().getLabels()));

        PodSpec podSpec = cronJob.getSpec().getJobTemplate().getSpec().getTemplate().getSpec();
        assertThat(podSpec.getRestartPolicy(), is("Never"));
        assertThat(podSpec.getServiceAccountName(), is("default"));

        assertThat(podSpec.getInitContainers(), hasSize(1));
        Container uninstall = podSpec.getInitContainers().get(0);
        assertThat(uninstall.getName(), is("helm-uninstall"));
        assertThat(uninstall.getImage(), is(CronJobService.DEFAULT_HELM_IMAGE));
        assertThat(uninstall.getCommand(), contains("helm", "uninstall", "myapp", "--namespace", "staging"));

        assertThat(podSpec.getContainers(), hasSize(1));
        Container selfCleanup = podSpec.getContainers().get(0);
        assertThat(selfCleanup.getName(), is("self-cleanup"));
        assertThat(selfCleanup.getImage(), is(CronJobService.DEFAULT_KUBECTL_IMAGE));
        assertThat(selfCleanup.getCommand(), contains("kubectl", "delete", "cronjob", "myapp-staging-ttl", "--namespace", "staging"));
    }

    @Test
    void buildCronJobDeletingNamespace() {
        CronJob cronJob = CronJobService.buildCronJob(options()
            .cronjobNamespace("ops")
            .deleteNamespace(true)
            .serviceAccount("myapp-staging-ttl")
            .helmImage("registry.local/helm:3")
            .kubectlImage("registry.local/kubectl:1")
            .build()
        );

        assertThat(cronJob.getMetadata().getName(), is("myapp-staging-ttl"));
        assertThat(cronJob.getMetadata().getNamespace(), is("ops"));
        assertThat(cronJob.getMetadata().getLabels(), hasEntry(Labels.DELETE_NAMESPACE, "true"));
        assertThat(cronJob.getMetadata().getLabels(), hasEntry(Labels.CRONJOB_NAMESPACE, "ops"));

        PodSpec podSpec = cronJob.getSpec().getJobTemplate().getSpec().getTemplate().getSpec();
        assertThat(podSpec.getServiceAccountName(), is("myapp-staging-ttl"));
        assertThat(podSpec.getInitContainers().stream().map(Container::getName).collect(Collectors.toList()), contains("helm-uninstall", "delete-namespace"));
        assertThat(podSpec.getInitContainers().get(0).getImage(), is("registry.local/helm:3"));
        assertThat(podSpec.getInitContainers().get(1).getImage(), is("registry.local/kubectl:1"));
        assertThat(podSpec.getInitContainers().get(1).getCommand(), contains("kubectl", "delete", "namespace", "staging"));
        assertThat(podSpec.getContainers().get(0).getCommand(), contains("kubectl", "delete", "cronjob", "myapp-staging-ttl", "--namespace", "ops"));
    }

    @Test
    void buildCronJobBlankImages() {
        CronJob cronJob = CronJobService.buildCronJob(options().helmImage("").kubectlImage("").build());

        PodSpec podSpec = cronJob.getSpec().getJobTemplate().getSpec().getTemplate().getSpec();
        assertThat(podSpec.getInitContainers().get(0).getImage(), is(CronJobService.DEFAULT_HELM_IMAGE));
        assertThat(podSpec.getContainers().get(0).getImage(), is(CronJobService.DEFAULT_KUBECTL_IMAGE));
    }

    @Test
    void buildCronJobNamespaceConflict() {
        ValidationException exception = assertThrows(
            ValidationException.class,
            () -> CronJobService.buildCronJob(options().releaseNamespace("ops").cronjobNamespace("ops").deleteNamespace(true).build())
        );

        assertThat(exception.getReason(), is(ValidationException.Reason.NAMESPACE_CONFLICT));
    }

    @Test
    void buildJob() {
        CronJob cronJob = CronJobService.buildCronJob(options().cronjobNamespace("ops").deleteNamespace(true).build());
        List<String> originalCommand = cronJob.getSpec().getJobTemplate().getSpec().getTemplate().getSpec().getContainers().get(0).getCommand();

        Job job = CronJobService.buildJob(cronJob, "myapp-staging-ttl-run");

        assertThat(job.getMetadata().getName(), is("myapp-staging-ttl-run"));
        assertThat(job.getMetadata().getNamespace(), is("ops"));
        assertThat(job.getMetadata().getLabels(), hasEntry(Labels.TRIGGERED_BY, "run"));
        assertThat(job.getMetadata().getLabels(), hasEntry(Labels.RELEASE, "myapp"));
        assertThat(job.getMetadata().getLabels(), hasEntry(Labels.DELETE_NAMESPACE, "true"));
        assertThat(job.getSpec().getBackoffLimit(), is(0));

        PodSpec podSpec = job.getSpec().getTemplate().getSpec();
        assertThat(podSpec.getInitContainers().stream().map(Container::getName).collect(Collectors.toList()), contains("helm-uninstall", "delete-namespace"));
        assertThat(podSpec.getContainers().get(0).getName(), is("self-cleanup"));
        assertThat(podSpec.getContainers().get(0).getCommand(), is(CronJobService.RUN_CLEANUP_COMMAND));

        // the cron job is left untouched
        assertThat(cronJob.getSpec().getJobTemplate().getSpec().getTemplate().getSpec().getContainers().get(0).getCommand(), is(originalCommand));
        assertThat(cronJob.getSpec().getJobTemplate().getSpec().getTemplate().getSpec().getContainers().get(0).getCommand(), contains("kubectl", "delete", "cronjob", "myapp-staging-ttl", "--namespace", "ops"));
        assertThat(cronJob.getMetadata().getLabels(), not(hasKey(Labels.TRIGGERED_BY)));
    }

    @Test
    void parseImageFromDockerfile() {
        assertThat(CronJobService.parseImageFromDockerfile("FROM alpine/helm:3.16.2\n"), is("alpine/helm:3.16.2"));
        assertThat(CronJobService.parseImageFromDockerfile("# pinned\n\n  from alpine/k8s:1.31.2  \nRUN true\n"), is("alpine/k8s:1.31.2"));
        assertThat(CronJobService.parseImageFromDockerfile("RUN true\n"), is(""));
    }

    @Test
    void defaultImages() {
        assertThat(CronJobService.DEFAULT_HELM_IMAGE, is("alpine/helm:3.16.2"));
        assertThat(CronJobService.DEFAULT_KUBECTL_IMAGE, is("alpine/k8s:1.31.2"));
    }
}
