package io.helmttl.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import io.helmttl.models.OutputFormat;
import io.helmttl.models.TtlInfo;

abstract public class OutputService {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
    );

    /**
     * Renders the TTL for display. Every format ends with a new line.
     */
    public static String format(TtlInfo info, OutputFormat format) throws JsonProcessingException {
        switch (format) {
            case JSON:
                return JSON_MAPPER.writeValueAsString(info) + "\n";
            case YAML:
                return YAML_MAPPER.writeValueAsString(info);
            default:
                return String.format(
                    "Release:          %s\n" +
                        "Release Namespace: %s\n" +
                        "CronJob Namespace: %s\n" +
                        "Scheduled Date:   %s\n" +
                        "Cron Schedule:    %s\n" +
                        "Delete Namespace: %s\n",
                    info.getReleaseName(),
                    info.getReleaseNamespace(),
                    info.getCronjobNamespace(),
                    info.getScheduledDate(),
                    info.getCronSchedule(),
                    info.isDeleteNamespace() ? "yes" : "no"
                );
        }
    }
}
