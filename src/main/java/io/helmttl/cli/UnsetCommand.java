package io.helmttl.cli;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.helmttl.exceptions.TtlNotFoundException;
import io.helmttl.ttl.UnsetTtl;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "unset", mixinStandardHelpOptions = true, description = "Remove the TTL of a Helm release")
public class UnsetCommand extends AbstractCommand {
    @Parameters(index = "0", paramLabel = "RELEASE", description = "name of the release")
    String releaseName;

    @Option(names = "--cronjob-namespace", description = "namespace where the CronJob lives (default: release namespace)")
    String cronjobNamespace;

    @Override
    public Integer call() throws Exception {
        String releaseNamespace = root.releaseNamespace();

        UnsetTtl task = UnsetTtl.builder()
            .releaseName(releaseName)
            .releaseNamespace(releaseNamespace)
            .cronjobNamespace(cronjobNamespace)
            .build();

        try (KubernetesClient client = client()) {
            task.run(client);

            out().printf("TTL removed for release \"%s\" in namespace \"%s\"\n", releaseName, releaseNamespace);
            out().flush();

            return 0;
        } catch (TtlNotFoundException e) {
            return fail(String.format("no TTL set for release \"%s\" in namespace \"%s\"", releaseName, releaseNamespace));
        }
    }
}
