package com.sensor.common.dto.kpi;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Closed min/max interval of a column.
 */
public record ValueRange(
    @JsonProperty("min")
    double min,

    @JsonProperty("max")
    double max
) {
    public static ValueRange zero() {
        return new ValueRange(0.0, 0.0);
    }
}
