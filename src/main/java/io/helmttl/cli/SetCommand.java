package io.helmttl.cli;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.helmttl.exceptions.ReleaseNotFoundException;
import io.helmttl.exceptions.ServiceAccountNotFoundException;
import io.helmttl.services.ScheduleService;
import io.helmttl.ttl.SetTtl;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
    name = "set",
    mixinStandardHelpOptions = true,
    description = {
        "Set a TTL on a Helm release.",
        "DURATION can be 30m, 2h, 7d, '3 days', '2 weeks', 'tomorrow', 'next monday', 'in 2 hours'..."
    }
)
public class SetCommand extends AbstractCommand {
    @Parameters(index = "0", paramLabel = "RELEASE", description = "name of the release")
    String releaseName;

    @Parameters(index = "1", paramLabel = "DURATION", description = "when to uninstall the release")
    String duration;

    @Option(names = "--service-account", defaultValue = "default", description = "service account for CronJob (default: ${DEFAULT-VALUE})")
    String serviceAccount;

    @Option(names = "--create-service-account", description = "create the service account and RBAC resources")
    boolean createServiceAccount;

    @Option(names = "--helm-image", description = "Helm container image (default: the bundled helm image)")
    String helmImage;

    @Option(names = "--kubectl-image", description = "kubectl container image (default: the bundled kubectl image)")
    String kubectlImage;

    @Option(names = "--cronjob-namespace", description = "namespace for the CronJob (default: release namespace)")
    String cronjobNamespace;

    @Option(names = "--delete-namespace", description = "also delete the release namespace after uninstalling")
    boolean deleteNamespace;

    @Override
    public Integer call() throws Exception {
        String releaseNamespace = root.releaseNamespace();

        SetTtl task = SetTtl.builder()
            .releaseName(releaseName)
            .releaseNamespace(releaseNamespace)
            .cronjobNamespace(cronjobNamespace)
            .duration(duration)
            .serviceAccount(serviceAccount)
            .createServiceAccount(createServiceAccount)
            .helmImage(helmImage)
            .kubectlImage(kubectlImage)
            .deleteNamespace(deleteNamespace)
            .driver(root.driver())
            .timeZone(root.getZone())
            .clock(root.getClock())
            .build();

        try (KubernetesClient client = client()) {
            SetTtl.Output output = task.run(client, root.getReleaseStoreFactory().create(client, root.driver()));

            out().printf("TTL set for release \"%s\" in namespace \"%s\"\n", releaseName, releaseNamespace);
            out().printf("Scheduled for %s (%s)\n", ScheduleService.formatScheduledDate(output.getScheduledDate()), output.getSchedule());
            out().flush();

            return 0;
        } catch (ReleaseNotFoundException e) {
            return fail(String.format("release \"%s\" not found in namespace \"%s\"", releaseName, releaseNamespace));
        } catch (ServiceAccountNotFoundException e) {
            return fail(String.format(
                "service account \"%s\" not found in namespace \"%s\"; use --create-service-account to create it",
                e.getName(),
                e.getNamespace()
            ));
        }
    }
}
