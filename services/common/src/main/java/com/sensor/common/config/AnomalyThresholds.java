package com.sensor.common.config;

import jakarta.validation.constraints.Positive;

/**
 * Thresholds used to flag readings during enrichment.
 * Z-score thresholds drive the alert flags; the absolute bands drive the out-of-range flags.
 */
public record AnomalyThresholds(
    @Positive
    double zscoreTemperature,

    @Positive
    double zscorePressure,

    double temperatureHigh,
    double temperatureLow,
    double pressureHigh,
    double pressureLow
) {
    public static final double DEFAULT_ZSCORE_TEMPERATURE = 2.0;
    public static final double DEFAULT_ZSCORE_PRESSURE = 2.5;
    public static final double DEFAULT_TEMPERATURE_HIGH = 80.0;  // °C
    public static final double DEFAULT_TEMPERATURE_LOW = 10.0;   // °C
    public static final double DEFAULT_PRESSURE_HIGH = 1100.0;   // hPa
    public static final double DEFAULT_PRESSURE_LOW = 900.0;     // hPa

    public AnomalyThresholds {
        if (!(zscoreTemperature > 0) || !(zscorePressure > 0)) {
            throw new IllegalArgumentException("Z-score thresholds must be positive");
        }
        if (temperatureLow > temperatureHigh) {
            throw new IllegalArgumentException(
                "temperatureLow (" + temperatureLow + ") exceeds temperatureHigh (" + temperatureHigh + ")");
        }
        if (pressureLow > pressureHigh) {
            throw new IllegalArgumentException(
                "pressureLow (" + pressureLow + ") exceeds pressureHigh (" + pressureHigh + ")");
        }
    }

    public static AnomalyThresholds defaults() {
        return new AnomalyThresholds(
            DEFAULT_ZSCORE_TEMPERATURE, DEFAULT_ZSCORE_PRESSURE,
            DEFAULT_TEMPERATURE_HIGH, DEFAULT_TEMPERATURE_LOW,
            DEFAULT_PRESSURE_HIGH, DEFAULT_PRESSURE_LOW
        );
    }

    public AnomalyThresholds withZscores(double temperature, double pressure) {
        return new AnomalyThresholds(temperature, pressure, temperatureHigh, temperatureLow, pressureHigh, pressureLow);
    }

    public boolean isTemperatureOutOfRange(double temperature) {
        return temperature > temperatureHigh || temperature < temperatureLow;
    }

    public boolean isPressureOutOfRange(double pressure) {
        return pressure > pressureHigh || pressure < pressureLow;
    }
}
