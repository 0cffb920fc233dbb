package io.helmttl.ttl;

import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.helmttl.RunnableTask;
import io.helmttl.exceptions.KubernetesOperationException;
import io.helmttl.exceptions.TtlNotFoundException;
import io.helmttl.services.RbacService;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.slf4j.Slf4j;

import java.net.HttpURLConnection;
import java.util.List;

/**
 * Removes the TTL of a release, then its service account and RBAC objects if any.
 */
@SuperBuilder
@ToString
@EqualsAndHashCode
@Getter
@NoArgsConstructor
@Slf4j
public class UnsetTtl extends AbstractTtl implements RunnableTask<UnsetTtl.Output> {
    @Override
    public UnsetTtl.Output run() throws Exception {
        try (KubernetesClient client = this.client()) {
            return this.run(client);
        }
    }

    public UnsetTtl.Output run(KubernetesClient client) {
        String name = this.resourceName();
        String cronjobNamespace = this.cronjobNamespace();

        List<StatusDetails> deleted;
        try {
            deleted = client.batch().v1().cronjobs().inNamespace(cronjobNamespace).withName(name).delete();
        } catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_NOT_FOUND) {
                throw new TtlNotFoundException(this.releaseName);
            }

            throw new KubernetesOperationException("failed to delete CronJob", e);
        }

        if (deleted.isEmpty()) {
            throw new TtlNotFoundException(this.releaseName);
        }

        log.info("CronJob '{}' is deleted from namespace '{}'", name, cronjobNamespace);

        boolean rbacRemoved = true;
        try {
            RbacService.teardown(client, this.releaseName, this.releaseNamespace, cronjobNamespace);
        } catch (KubernetesOperationException e) {
            log.warn("Unable to remove service account and RBAC of release '{}', use cleanup-rbac to remove them", this.releaseName, e);
            rbacRemoved = false;
        }

        return Output.builder()
            .cronJobName(name)
            .rbacRemoved(rbacRemoved)
            .build();
    }

    @Builder
    @Getter
    public static class Output {
        private final String cronJobName;

        private final boolean rbacRemoved;
    }
}
