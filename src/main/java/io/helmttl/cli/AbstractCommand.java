package io.helmttl.cli;

import io.fabric8.kubernetes.client.KubernetesClient;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

abstract class AbstractCommand implements Callable<Integer> {
    @ParentCommand
    protected HelmTtl root;

    @Spec
    protected CommandSpec spec;

    @Mixin
    protected KubeOptions kubeOptions;

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected int fail(String message) {
        spec.commandLine().getErr().println("Error: " + message);
        return 1;
    }

    protected KubernetesClient client() throws IOException {
        return root.getClientFactory().create(root.connection(kubeOptions));
    }
}
