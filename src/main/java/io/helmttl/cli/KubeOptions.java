package io.helmttl.cli;

import picocli.CommandLine.Option;

public class KubeOptions {
    @Option(names = "--kube-context", description = "name of the kubeconfig context to use (default: $HELM_KUBECONTEXT)")
    String kubeContext;

    @Option(names = "--kubeconfig", description = "path to the kubeconfig file (default: $KUBECONFIG)")
    String kubeconfig;
}
