package io.helmttl.models;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum OutputFormat {
    TEXT,
    JSON,
    YAML;

    public static OutputFormat from(String value) {
        try {
            return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException(
                "unsupported output format '" + value + "'; valid formats: " +
                    Arrays.stream(values()).map(f -> f.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", "))
            );
        }
    }
}
