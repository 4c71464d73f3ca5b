package com.sensor.etl.config;

import com.sensor.common.config.AnomalyThresholds;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Pipeline options bound from {@code sensor.pipeline.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "sensor.pipeline")
public class PipelineProperties {

    @NotBlank
    private String sourcePath = "data/raw_sensor_data.csv";

    @NotBlank
    @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_]*", message = "must be a plain SQL identifier")
    private String tableName = "sensor_data";

    @NotBlank
    private String exportPath = "data/processed_sensor_data.csv";

    @Min(1)
    private int syntheticRows = 100;

    @NotNull
    private Duration syntheticInterval = Duration.ofHours(1);

    /**
     * Fixed seed for reproducible synthetic data; random when unset.
     */
    private Long syntheticSeed;

    private boolean persistSyntheticSource = true;

    @Positive
    private double zscoreThresholdTemperature = AnomalyThresholds.DEFAULT_ZSCORE_TEMPERATURE;

    @Positive
    private double zscoreThresholdPressure = AnomalyThresholds.DEFAULT_ZSCORE_PRESSURE;

    private double temperatureHigh = AnomalyThresholds.DEFAULT_TEMPERATURE_HIGH;
    private double temperatureLow = AnomalyThresholds.DEFAULT_TEMPERATURE_LOW;
    private double pressureHigh = AnomalyThresholds.DEFAULT_PRESSURE_HIGH;
    private double pressureLow = AnomalyThresholds.DEFAULT_PRESSURE_LOW;

    public AnomalyThresholds toThresholds() {
        return new AnomalyThresholds(zscoreThresholdTemperature, zscoreThresholdPressure,
                temperatureHigh, temperatureLow, pressureHigh, pressureLow);
    }
}
