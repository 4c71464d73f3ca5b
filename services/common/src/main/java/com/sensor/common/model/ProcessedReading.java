package com.sensor.common.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A cleaned reading enriched with calendar features and anomaly flags.
 * This is the row shape persisted by the store adapters.
 */
public record ProcessedReading(
    LocalDateTime timestamp,
    double temperature,
    double pressure,
    double uptime,
    int hour,
    int dayOfWeek,
    int month,
    double temperatureZscore,
    double pressureZscore,
    boolean temperatureAlert,
    boolean pressureAlert,
    boolean temperatureOutOfRange,
    boolean pressureOutOfRange
) {
    public ProcessedReading {
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    /**
     * True when either Z-score alert is raised.
     */
    public boolean hasAlert() {
        return temperatureAlert || pressureAlert;
    }

    public boolean isOutOfRange() {
        return temperatureOutOfRange || pressureOutOfRange;
    }

    /**
     * Drops the derived columns.
     */
    public RawReading toRaw() {
        return new RawReading(timestamp, temperature, pressure, uptime);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LocalDateTime timestamp;
        private double temperature;
        private double pressure;
        private double uptime;
        private int hour;
        private int dayOfWeek;
        private int month;
        private double temperatureZscore;
        private double pressureZscore;
        private boolean temperatureAlert;
        private boolean pressureAlert;
        private boolean temperatureOutOfRange;
        private boolean pressureOutOfRange;

        public Builder timestamp(LocalDateTime timestamp) { this.timestamp = timestamp; return this; }
        public Builder temperature(double temperature) { this.temperature = temperature; return this; }
        public Builder pressure(double pressure) { this.pressure = pressure; return this; }
        public Builder uptime(double uptime) { this.uptime = uptime; return this; }
        public Builder hour(int hour) { this.hour = hour; return this; }
        public Builder dayOfWeek(int dayOfWeek) { this.dayOfWeek = dayOfWeek; return this; }
        public Builder month(int month) { this.month = month; return this; }
        public Builder temperatureZscore(double temperatureZscore) { this.temperatureZscore = temperatureZscore; return this; }
        public Builder pressureZscore(double pressureZscore) { this.pressureZscore = pressureZscore; return this; }
        public Builder temperatureAlert(boolean temperatureAlert) { this.temperatureAlert = temperatureAlert; return this; }
        public Builder pressureAlert(boolean pressureAlert) { this.pressureAlert = pressureAlert; return this; }
        public Builder temperatureOutOfRange(boolean temperatureOutOfRange) { this.temperatureOutOfRange = temperatureOutOfRange; return this; }
        public Builder pressureOutOfRange(boolean pressureOutOfRange) { this.pressureOutOfRange = pressureOutOfRange; return this; }

        /**
         * Copies the measured values and derives the calendar columns from the timestamp.
         */
        public Builder from(RawReading raw) {
            this.timestamp = raw.timestamp();
            this.temperature = raw.temperature();
            this.pressure = raw.pressure();
            this.uptime = raw.uptime();
            this.hour = raw.timestamp().getHour();
            this.dayOfWeek = raw.timestamp().getDayOfWeek().getValue();
            this.month = raw.timestamp().getMonthValue();
            return this;
        }

        public ProcessedReading build() {
            return new ProcessedReading(
                timestamp, temperature, pressure, uptime,
                hour, dayOfWeek, month,
                temperatureZscore, pressureZscore,
                temperatureAlert, pressureAlert,
                temperatureOutOfRange, pressureOutOfRange
            );
        }
    }
}
