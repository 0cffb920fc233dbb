package io.helmttl.exceptions;

import lombok.Getter;

@Getter
public class ReleaseNotFoundException extends TtlException {
    private final String releaseName;

    public ReleaseNotFoundException(String releaseName) {
        super("release '" + releaseName + "' not found");
        this.releaseName = releaseName;
    }
}
