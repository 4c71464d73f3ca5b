package com.sensor.etl.quality;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sensor.common.model.SensorColumn;

/**
 * A single degraded-data observation. {@code column} is null for row- and source-level issues.
 */
public record DataIssue(
    @JsonProperty("type")
    DataIssueType type,

    @JsonProperty("column")
    SensorColumn column,

    @JsonProperty("message")
    String message
) {
    public static DataIssue of(DataIssueType type, String message) {
        return new DataIssue(type, null, message);
    }

    public static DataIssue of(DataIssueType type, SensorColumn column, String message) {
        return new DataIssue(type, column, message);
    }
}
