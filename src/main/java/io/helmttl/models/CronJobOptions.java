package io.helmttl.models;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Desired configuration of a TTL CronJob.
 */
@Builder(toBuilder = true)
@Getter
@ToString
public class CronJobOptions {
    private final String releaseName;

    private final String releaseNamespace;

    private final String cronjobNamespace;

    private final String schedule;

    private final String timeZone;

    private final String serviceAccount;

    private final String helmImage;

    private final String kubectlImage;

    private final boolean deleteNamespace;
}
