package io.helmttl.models;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import lombok.Builder;
import lombok.Getter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Connection parameters to the Kubernetes cluster, as Helm resolves them.
 * <p>
 * The configuration is loaded from the {@code kubeconfig} file when given, else with the usual fabric8 lookup:
 * system properties, environment variables, {@code ~/.kube/config} and the in-cluster service account.
 * {@code context} selects the kubeconfig context, the current one when not set.
 */
@Builder
@Getter
public class Connection {
    private final String kubeconfig;

    private final String context;

    /**
     * In milliseconds.
     */
    @Builder.Default
    private final Integer requestTimeout = 30_000;

    public Config toConfig() throws IOException {
        ConfigBuilder builder = new ConfigBuilder(baseConfig());

        if (requestTimeout != null) {
            builder.withRequestTimeout(requestTimeout);
        }

        return builder.build();
    }

    private Config baseConfig() throws IOException {
        if (kubeconfig != null) {
            String content = Files.readString(Path.of(kubeconfig));
            return Config.fromKubeconfig(context, content, kubeconfig);
        }

        return Config.autoConfigure(context);
    }
}
