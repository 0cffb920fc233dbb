package io.helmttl.models;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Bookkeeping labels put on every object helm-ttl creates. They are the only link between a CronJob and its
 * service account and RBAC objects.
 */
public final class Labels {
    public static final String MANAGED_BY = "app.kubernetes.io/managed-by";
    public static final String MANAGED_BY_VALUE = "helm-ttl";
    public static final String RELEASE = "helm-ttl/release";
    public static final String RELEASE_NAMESPACE = "helm-ttl/release-namespace";
    public static final String CRONJOB_NAMESPACE = "helm-ttl/cronjob-namespace";
    public static final String DELETE_NAMESPACE = "helm-ttl/delete-namespace";
    public static final String TRIGGERED_BY = "helm-ttl/triggered-by";

    private Labels() {
    }

    public static Map<String, String> of(String releaseName, String releaseNamespace, String cronjobNamespace, boolean deleteNamespace) {
        return ImmutableMap.of(
            MANAGED_BY, MANAGED_BY_VALUE,
            RELEASE, releaseName,
            RELEASE_NAMESPACE, releaseNamespace,
            CRONJOB_NAMESPACE, cronjobNamespace,
            DELETE_NAMESPACE, String.valueOf(deleteNamespace)
        );
    }

    public static boolean deleteNamespace(Map<String, String> labels) {
        return labels != null && "true".equals(labels.get(DELETE_NAMESPACE));
    }
}
