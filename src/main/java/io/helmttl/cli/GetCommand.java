package io.helmttl.cli;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.helmttl.exceptions.TtlNotFoundException;
import io.helmttl.models.OutputFormat;
import io.helmttl.services.OutputService;
import io.helmttl.ttl.GetTtl;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "get", mixinStandardHelpOptions = true, description = "Show the TTL of a Helm release")
public class GetCommand extends AbstractCommand {
    @Parameters(index = "0", paramLabel = "RELEASE", description = "name of the release")
    String releaseName;

    @Option(names = {"-o", "--output"}, defaultValue = "text", description = "output format: text, yaml, json")
    String output;

    @Option(names = "--cronjob-namespace", description = "namespace where the CronJob lives (default: release namespace)")
    String cronjobNamespace;

    @Override
    public Integer call() throws Exception {
        OutputFormat format = OutputFormat.from(output);
        String releaseNamespace = root.releaseNamespace();

        GetTtl task = GetTtl.builder()
            .releaseName(releaseName)
            .releaseNamespace(releaseNamespace)
            .cronjobNamespace(cronjobNamespace)
            .timeZone(root.getZone())
            .clock(root.getClock())
            .build();

        try (KubernetesClient client = client()) {
            out().print(OutputService.format(task.run(client).getTtl(), format));
            out().flush();

            return 0;
        } catch (TtlNotFoundException e) {
            return fail(String.format("no TTL set for release \"%s\" in namespace \"%s\"", releaseName, releaseNamespace));
        }
    }
}
