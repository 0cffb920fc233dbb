package io.helmttl.cli;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import io.helmttl.models.Connection;
import io.helmttl.services.ClientService;
import io.helmttl.services.HelmReleaseStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.File;
import java.time.Clock;
import java.time.ZoneId;
import java.util.Map;

/**
 * Entry point of the {@code helm ttl} plugin.
 * <p>
 * The Helm environment ({@code HELM_NAMESPACE}, {@code HELM_KUBECONTEXT}, {@code KUBECONFIG}, {@code HELM_DRIVER})
 * is only read here and handed to the operations as plain values.
 */
@Command(
    name = "helm-ttl",
    mixinStandardHelpOptions = true,
    version = "helm-ttl 0.1.0",
    description = "Manage TTL (time-to-live) for Helm releases",
    subcommands = {
        SetCommand.class,
        GetCommand.class,
        UnsetCommand.class,
        RunCommand.class,
        CleanupRbacCommand.class
    }
)
@Slf4j
@Getter
public class HelmTtl implements Runnable {
    public static final String DEFAULT_NAMESPACE = "default";

    @Spec
    private CommandSpec spec;

    private final Map<String, String> env;
    private final ClientFactory clientFactory;
    private final ReleaseStoreFactory releaseStoreFactory;
    private final Clock clock;
    private final ZoneId zone;

    public HelmTtl() {
        this(System.getenv(), ClientService::of, HelmReleaseStore::new, Clock.systemUTC(), ZoneId.systemDefault());
    }

    @VisibleForTesting
    HelmTtl(Map<String, String> env, ClientFactory clientFactory, ReleaseStoreFactory releaseStoreFactory, Clock clock, ZoneId zone) {
        this.env = env;
        this.clientFactory = clientFactory;
        this.releaseStoreFactory = releaseStoreFactory;
        this.clock = clock;
        this.zone = zone;
    }

    public static void main(String[] args) {
        System.exit(commandLine(new HelmTtl()).execute(args));
    }

    public static CommandLine commandLine(HelmTtl root) {
        return new CommandLine(root)
            .setExecutionExceptionHandler((exception, commandLine, parseResult) -> {
                log.debug("Command '{}' failed", commandLine.getCommandName(), exception);
                commandLine.getErr().println("Error: " + exception.getMessage());
                return commandLine.getCommandSpec().exitCodeOnExecutionException();
            });
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    String releaseNamespace() {
        return env("HELM_NAMESPACE", DEFAULT_NAMESPACE);
    }

    String driver() {
        return env("HELM_DRIVER", HelmReleaseStore.DEFAULT_DRIVER);
    }

    /**
     * Flags win over the environment. Only the first file of a {@code KUBECONFIG} list is used.
     */
    Connection connection(KubeOptions options) {
        String context = Strings.isNullOrEmpty(options.kubeContext) ? env("HELM_KUBECONTEXT", null) : options.kubeContext;

        String kubeconfig = options.kubeconfig;
        if (Strings.isNullOrEmpty(kubeconfig) && !Strings.isNullOrEmpty(env("KUBECONFIG", null))) {
            kubeconfig = Splitter.on(File.pathSeparatorChar).omitEmptyStrings().splitToList(env("KUBECONFIG", null))
                .stream()
                .findFirst()
                .orElse(null);
        }

        return Connection.builder()
            .context(context)
            .kubeconfig(kubeconfig)
            .build();
    }

    private String env(String name, String defaultValue) {
        String value = this.env.get(name);
        return Strings.isNullOrEmpty(value) ? defaultValue : value;
    }
}
