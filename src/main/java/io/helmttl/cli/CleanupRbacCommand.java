package io.helmttl.cli;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.helmttl.models.OrphanedResource;
import io.helmttl.ttl.CleanupRbac;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

@Command(
    name = "cleanup-rbac",
    mixinStandardHelpOptions = true,
    description = "Delete service accounts and RBAC resources whose TTL CronJob no longer exists"
)
public class CleanupRbacCommand extends AbstractCommand {
    @Option(names = "--dry-run", description = "print what would be deleted without deleting")
    boolean dryRun;

    @Option(names = {"-A", "--all-namespaces"}, description = "search all namespaces for orphaned resources")
    boolean allNamespaces;

    @Override
    public Integer call() throws Exception {
        CleanupRbac task = CleanupRbac.builder()
            .namespaces(List.of(root.releaseNamespace()))
            .allNamespaces(allNamespaces)
            .dryRun(dryRun)
            .build();

        try (KubernetesClient client = client()) {
            List<OrphanedResource> orphans = task.run(client).getOrphans();

            if (orphans.isEmpty()) {
                out().println("No orphaned resources found");
            }

            for (OrphanedResource orphan : orphans) {
                out().printf(dryRun ? "Would delete %s\n" : "Deleted %s\n", orphan);
            }
            out().flush();

            return 0;
        }
    }
}
