package io.helmttl.exceptions;

import lombok.Getter;

@Getter
public class TtlNotFoundException extends TtlException {
    private final String releaseName;

    public TtlNotFoundException(String releaseName) {
        super("no TTL set for release '" + releaseName + "'");
        this.releaseName = releaseName;
    }
}
