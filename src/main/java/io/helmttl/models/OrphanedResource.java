package io.helmttl.models;

import lombok.Value;

@Value(staticConstructor = "of")
public class OrphanedResource {
    String kind;

    String name;

    /**
     * {@code null} for cluster-scoped objects.
     */
    String namespace;

    public static OrphanedResource clusterScoped(String kind, String name) {
        return of(kind, name, null);
    }

    @Override
    public String toString() {
        if (namespace != null) {
            return kind + " " + name + " in namespace " + namespace;
        }

        return kind + " " + name + " (cluster-scoped)";
    }
}
