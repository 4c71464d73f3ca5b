package com.sensor.common.dto.kpi;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Aggregate summary of a set of processed readings, recomputed on every request.
 *
 * Example JSON:
 * {
 *   "avg_temp": 61.42,
 *   "avg_pressure": 1001.7,
 *   "temperature_range": {"min": 38.1, "max": 91.3},
 *   "pressure_range": {"min": 921.0, "max": 1088.4},
 *   "alert_count": 4,
 *   "temperature_alert_count": 3,
 *   "pressure_alert_count": 1,
 *   "pressure_warning_count": 5,
 *   "out_of_range_count": 6,
 *   "uptime_hours": 99.0,
 *   "total_records": 100,
 *   "date_filter": "2024-01-15",
 *   "no_data": false
 * }
 */
public record KpiSnapshot(
    @JsonProperty("avg_temp")
    double avgTemperature,

    @JsonProperty("avg_pressure")
    double avgPressure,

    @JsonProperty("temperature_range")
    ValueRange temperatureRange,

    @JsonProperty("pressure_range")
    ValueRange pressureRange,

    @JsonProperty("alert_count")
    long alertCount,

    @JsonProperty("temperature_alert_count")
    long temperatureAlertCount,

    @JsonProperty("pressure_alert_count")
    long pressureAlertCount,

    @JsonProperty("pressure_warning_count")
    long pressureWarningCount,

    @JsonProperty("out_of_range_count")
    long outOfRangeCount,

    @JsonProperty("uptime_hours")
    double uptimeHours,

    @JsonProperty("total_records")
    long totalRecords,

    @JsonProperty("date_filter")
    LocalDate dateFilter,

    @JsonProperty("no_data")
    boolean noData
) {
    /**
     * Zeroed snapshot returned when nothing matches the filter.
     */
    public static KpiSnapshot empty(LocalDate dateFilter) {
        return new KpiSnapshot(
            0.0, 0.0,
            ValueRange.zero(), ValueRange.zero(),
            0, 0, 0, 0, 0,
            0.0, 0,
            dateFilter,
            true
        );
    }
}
