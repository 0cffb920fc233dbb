package io.helmttl.services;

import java.io.IOException;
import java.io.InputStream;

/**
 * Opens the log stream of a container.
 */
@FunctionalInterface
public interface LogFetcher {
    InputStream fetch(String namespace, String podName, String containerName) throws IOException;
}
