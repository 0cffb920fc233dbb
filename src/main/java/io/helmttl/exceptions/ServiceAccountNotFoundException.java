package io.helmttl.exceptions;

import lombok.Getter;

@Getter
public class ServiceAccountNotFoundException extends TtlException {
    private final String name;
    private final String namespace;

    public ServiceAccountNotFoundException(String name, String namespace) {
        super("service account '" + name + "' not found in namespace '" + namespace + "'");
        this.name = name;
        this.namespace = namespace;
    }
}
