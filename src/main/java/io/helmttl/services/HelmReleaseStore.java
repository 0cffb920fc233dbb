package io.helmttl.services;

import com.google.common.base.Strings;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.helmttl.exceptions.KubernetesOperationException;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;

/**
 * Reads the release records Helm 3 writes through its {@code secrets} (default) or {@code configmaps} storage
 * driver: one object per revision, labelled {@code owner=helm} and {@code name=<release>}, in the release namespace.
 */
@Slf4j
public class HelmReleaseStore implements ReleaseStore {
    public static final String DEFAULT_DRIVER = "secrets";

    private final KubernetesClient client;
    private final Driver driver;

    enum Driver {
        SECRETS,
        CONFIGMAPS
    }

    public HelmReleaseStore(KubernetesClient client, String driver) {
        this.client = client;
        this.driver = driver(driver);
    }

    @Override
    public boolean exists(String releaseName, String namespace) {
        Map<String, String> labels = Map.of("owner", "helm", "name", releaseName);

        try {
            boolean found;
            if (driver == Driver.CONFIGMAPS) {
                found = !client.configMaps().inNamespace(namespace).withLabels(labels).list().getItems().isEmpty();
            } else {
                found = !client.secrets().inNamespace(namespace).withLabels(labels).list().getItems().isEmpty();
            }

            log.debug("Release '{}' in namespace '{}' {} in the {} store", releaseName, namespace, found ? "found" : "not found", driver.name().toLowerCase(Locale.ROOT));
            return found;
        } catch (KubernetesClientException e) {
            throw new KubernetesOperationException("failed to look up release '" + releaseName + "'", e);
        }
    }

    static Driver driver(String value) {
        switch (Strings.isNullOrEmpty(value) ? DEFAULT_DRIVER : value.toLowerCase(Locale.ROOT)) {
            case "secret":
            case "secrets":
                return Driver.SECRETS;
            case "configmap":
            case "configmaps":
                return Driver.CONFIGMAPS;
            default:
                throw new IllegalArgumentException("unsupported Helm storage driver '" + value + "'; supported drivers: secrets, configmaps");
        }
    }
}
