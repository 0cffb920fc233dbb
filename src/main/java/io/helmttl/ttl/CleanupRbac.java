package io.helmttl.ttl;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.helmttl.AbstractConnection;
import io.helmttl.RunnableTask;
import io.helmttl.models.OrphanedResource;
import io.helmttl.services.RbacService;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Removes the service accounts and RBAC objects left behind by TTLs that already fired or were removed by hand.
 */
@SuperBuilder
@ToString
@EqualsAndHashCode
@Getter
@NoArgsConstructor
@Slf4j
public class CleanupRbac extends AbstractConnection implements RunnableTask<CleanupRbac.Output> {
    /**
     * The namespaces to scan for roles, role bindings and service accounts. Cluster-scoped objects are always scanned.
     */
    @Builder.Default
    private List<String> namespaces = List.of("default");

    @Builder.Default
    private boolean allNamespaces = false;

    /**
     * Only report the orphans.
     */
    @Builder.Default
    private boolean dryRun = false;

    @Override
    public CleanupRbac.Output run() throws Exception {
        try (KubernetesClient client = this.client()) {
            return this.run(client);
        }
    }

    public CleanupRbac.Output run(KubernetesClient client) {
        List<OrphanedResource> orphans = RbacService.findOrphans(client, this.namespaces, this.allNamespaces, this.dryRun);

        log.info("{} orphaned resource(s) {}", orphans.size(), this.dryRun ? "found" : "deleted");

        return Output.builder()
            .orphans(orphans)
            .dryRun(this.dryRun)
            .build();
    }

    @Builder
    @Getter
    public static class Output {
        private final List<OrphanedResource> orphans;

        private final boolean dryRun;
    }
}
