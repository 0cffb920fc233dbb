package io.helmttl.models;

import lombok.Value;

@Value(staticConstructor = "of")
public class ContainerResult {
    String name;

    int exitCode;
}
