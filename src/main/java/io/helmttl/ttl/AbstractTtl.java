package io.helmttl.ttl;

import com.google.common.base.Strings;
import io.helmttl.AbstractConnection;
import io.helmttl.services.ResourceNameService;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Base of the operations targeting the TTL of one release.
 */
@SuperBuilder
@ToString
@EqualsAndHashCode
@Getter
@NoArgsConstructor
public abstract class AbstractTtl extends AbstractConnection {
    /**
     * The name of the Helm release.
     */
    protected String releaseName;

    /**
     * The namespace the release is installed in.
     */
    protected String releaseNamespace;

    /**
     * The namespace holding the CronJob and its service account. Defaults to the release namespace.
     */
    protected String cronjobNamespace;

    public String cronjobNamespace() {
        return Strings.isNullOrEmpty(this.cronjobNamespace) ? this.releaseNamespace : this.cronjobNamespace;
    }

    protected String resourceName() {
        return ResourceNameService.resourceName(this.releaseName, this.releaseNamespace);
    }
}
