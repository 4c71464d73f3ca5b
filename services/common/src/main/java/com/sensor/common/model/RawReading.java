package com.sensor.common.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A single reading as extracted from the source, before cleaning.
 * A missing numeric value is represented as {@link Double#NaN}.
 */
public record RawReading(
    LocalDateTime timestamp,
    double temperature,
    double pressure,
    double uptime
) {
    public RawReading {
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public static RawReading of(LocalDateTime timestamp, double temperature, double pressure, double uptime) {
        return new RawReading(timestamp, temperature, pressure, uptime);
    }

    /**
     * Returns a copy with the given column replaced.
     */
    public RawReading with(SensorColumn column, double value) {
        return switch (column) {
            case TEMPERATURE -> new RawReading(timestamp, value, pressure, uptime);
            case PRESSURE -> new RawReading(timestamp, temperature, value, uptime);
            case UPTIME -> new RawReading(timestamp, temperature, pressure, value);
        };
    }
}
