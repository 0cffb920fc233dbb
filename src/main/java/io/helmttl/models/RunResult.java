package io.helmttl.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a synchronous TTL run. Container results keep the execution order, init containers first.
 */
@Value
@Builder(toBuilder = true)
public class RunResult {
    String releaseName;

    String releaseNamespace;

    boolean deletedNamespace;

    boolean jobFailed;

    @Singular
    List<ContainerResult> containerResults;
}
