package com.sensor.common.model;

/**
 * Numeric columns carried by every reading.
 */
public enum SensorColumn {
    TEMPERATURE("temperature"),
    PRESSURE("pressure"),
    UPTIME("uptime");

    private final String value;

    SensorColumn(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Reads this column from a reading. Missing values come back as NaN.
     */
    public double read(RawReading reading) {
        return switch (this) {
            case TEMPERATURE -> reading.temperature();
            case PRESSURE -> reading.pressure();
            case UPTIME -> reading.uptime();
        };
    }
}
