package io.helmttl.cli;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.helmttl.exceptions.RunFailedException;
import io.helmttl.exceptions.TtlNotFoundException;
import io.helmttl.models.ContainerResult;
import io.helmttl.models.RunResult;
import io.helmttl.services.PodLogService;
import io.helmttl.ttl.RunTtl;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;

@Command(
    name = "run",
    mixinStandardHelpOptions = true,
    description = {
        "Run the TTL of a Helm release now and wait for it to complete.",
        "The CronJob, its service account and RBAC resources are removed afterwards."
    }
)
public class RunCommand extends AbstractCommand {
    @Parameters(index = "0", paramLabel = "RELEASE", description = "name of the release")
    String releaseName;

    @Option(names = "--cronjob-namespace", description = "namespace where the CronJob lives (default: release namespace)")
    String cronjobNamespace;

    @Option(names = "--wait-until-running", defaultValue = "PT10M", description = "maximum time to wait for the pod, ISO-8601 (default: ${DEFAULT-VALUE})")
    Duration waitUntilRunning;

    @Option(names = "--wait-running", defaultValue = "PT1H", description = "maximum time to wait for the containers, ISO-8601 (default: ${DEFAULT-VALUE})")
    Duration waitRunning;

    @Override
    public Integer call() throws Exception {
        String releaseNamespace = root.releaseNamespace();

        RunTtl task = RunTtl.builder()
            .releaseName(releaseName)
            .releaseNamespace(releaseNamespace)
            .cronjobNamespace(cronjobNamespace)
            .waitUntilRunning(waitUntilRunning)
            .waitRunning(waitRunning)
            .build();

        try (
            KubernetesClient client = client();
            PrintWriterOutputStream logs = new PrintWriterOutputStream(out())
        ) {
            RunResult result = task.run(client, logs, PodLogService.fetcher(client)).getResult();

            summary(result);
            out().printf("TTL executed for release \"%s\" in namespace \"%s\"\n", releaseName, releaseNamespace);
            if (result.isDeletedNamespace()) {
                out().printf("Namespace \"%s\" deleted\n", releaseNamespace);
            }
            out().flush();

            return 0;
        } catch (TtlNotFoundException e) {
            return fail(String.format("no TTL set for release \"%s\" in namespace \"%s\"", releaseName, releaseNamespace));
        } catch (RunFailedException e) {
            if (e.getResult() != null) {
                summary(e.getResult());
            }

            return fail(e.getMessage());
        }
    }

    private void summary(RunResult result) {
        for (ContainerResult container : result.getContainerResults()) {
            out().printf("Container %s exited with code %d\n", container.getName(), container.getExitCode());
        }
        out().flush();
    }
}
