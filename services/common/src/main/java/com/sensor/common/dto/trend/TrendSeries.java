package com.sensor.common.dto.trend;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Chart-ready parallel arrays, ascending by timestamp.
 *
 * Example JSON:
 * {
 *   "timestamps": ["2024-01-15T10:00:00", "2024-01-15T11:00:00"],
 *   "temperatures": [61.2, 63.8],
 *   "pressures": [1003.1, 998.4],
 *   "uptime_hours": [10.0, 11.0],
 *   "record_count": 2,
 *   "date_filter": "2024-01-15"
 * }
 */
public record TrendSeries(
    @JsonProperty("timestamps")
    List<LocalDateTime> timestamps,

    @JsonProperty("temperatures")
    List<Double> temperatures,

    @JsonProperty("pressures")
    List<Double> pressures,

    @JsonProperty("uptime_hours")
    List<Double> uptime,

    @JsonProperty("record_count")
    int recordCount,

    @JsonProperty("date_filter")
    LocalDate dateFilter
) {
    public TrendSeries {
        timestamps = List.copyOf(timestamps);
        temperatures = List.copyOf(temperatures);
        pressures = List.copyOf(pressures);
        uptime = List.copyOf(uptime);
        int n = timestamps.size();
        if (temperatures.size() != n || pressures.size() != n || uptime.size() != n || recordCount != n) {
            throw new IllegalArgumentException("Trend series arrays must all have length " + n);
        }
    }

    public static TrendSeries empty(LocalDate dateFilter) {
        return new TrendSeries(List.of(), List.of(), List.of(), List.of(), 0, dateFilter);
    }

    public boolean isEmpty() {
        return recordCount == 0;
    }
}
