package io.helmttl.services;

import io.helmttl.exceptions.ValidationException;

abstract public class ResourceNameService {
    /**
     * CronJob name + "-" + 10 chars timestamp is the Job name and Jobs add a suffix for their pods,
     * so the CronJob name must stay well below the 63 chars limit.
     */
    public static final int MAX_RESOURCE_NAME_LENGTH = 52;

    public static final String RUN_SUFFIX = "-run";

    /**
     * @return {@code <release>-<releaseNamespace>-ttl}, the name shared by the CronJob and its RBAC objects
     * @throws ValidationException if the name is longer than {@link #MAX_RESOURCE_NAME_LENGTH}
     */
    public static String resourceName(String releaseName, String releaseNamespace) {
        String name = releaseName + "-" + releaseNamespace + "-ttl";

        if (name.length() > MAX_RESOURCE_NAME_LENGTH) {
            throw new ValidationException(
                ValidationException.Reason.NAME_TOO_LONG,
                "resource name '" + name + "' exceeds maximum length of " + MAX_RESOURCE_NAME_LENGTH +
                    " characters (got " + name.length() + "); use shorter release or namespace names"
            );
        }

        return name;
    }

    public static String runName(String resourceName) {
        return resourceName + RUN_SUFFIX;
    }
}
