package io.helmttl.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
@JsonPropertyOrder({"release_name", "release_namespace", "cronjob_namespace", "scheduled_date", "cron_schedule", "delete_namespace"})
public class TtlInfo {
    @JsonProperty("release_name")
    String releaseName;

    @JsonProperty("release_namespace")
    String releaseNamespace;

    @JsonProperty("cronjob_namespace")
    String cronjobNamespace;

    /**
     * ISO-8601 date time with offset.
     */
    @JsonProperty("scheduled_date")
    String scheduledDate;

    @JsonProperty("cron_schedule")
    String cronSchedule;

    @JsonProperty("delete_namespace")
    boolean deleteNamespace;
}
