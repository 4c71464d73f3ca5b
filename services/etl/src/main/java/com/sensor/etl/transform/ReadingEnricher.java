package com.sensor.etl.transform;

import com.sensor.common.config.AnomalyThresholds;
import com.sensor.common.model.ProcessedReading;
import com.sensor.common.model.RawReading;
import com.sensor.common.model.SensorColumn;
import com.sensor.etl.quality.DataIssue;
import com.sensor.etl.quality.DataIssueType;
import com.sensor.etl.quality.DataQualityReport;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives calendar fields, batch Z-scores and anomaly flags for cleaned readings.
 * <p>
 * Z-scores use the population standard deviation of the whole batch. A column whose standard
 * deviation is zero (within tolerance) scores 0 everywhere and raises no alert.
 */
@Slf4j
public class ReadingEnricher {

    static final double DEGENERATE_TOLERANCE = 1e-9;

    public List<ProcessedReading> enrich(List<RawReading> readings, AnomalyThresholds thresholds) {
        return enrich(readings, thresholds, new DataQualityReport());
    }

    public List<ProcessedReading> enrich(List<RawReading> readings, AnomalyThresholds thresholds,
                                         DataQualityReport report) {
        ZScorer temperature = ZScorer.of(readings, SensorColumn.TEMPERATURE, report);
        ZScorer pressure = ZScorer.of(readings, SensorColumn.PRESSURE, report);

        List<ProcessedReading> enriched = new ArrayList<>(readings.size());
        for (RawReading reading : readings) {
            double zTemperature = temperature.score(reading.temperature());
            double zPressure = pressure.score(reading.pressure());

            enriched.add(ProcessedReading.builder()
                    .from(reading)
                    .temperatureZscore(zTemperature)
                    .pressureZscore(zPressure)
                    .temperatureAlert(!temperature.degenerate() && Math.abs(zTemperature) > thresholds.zscoreTemperature())
                    .pressureAlert(!pressure.degenerate() && Math.abs(zPressure) > thresholds.zscorePressure())
                    .temperatureOutOfRange(thresholds.isTemperatureOutOfRange(reading.temperature()))
                    .pressureOutOfRange(thresholds.isPressureOutOfRange(reading.pressure()))
                    .build());
        }

        log.debug("Enriched {} readings (temperature mean={} std={}, pressure mean={} std={})",
                enriched.size(), temperature.mean(), temperature.stdDev(), pressure.mean(), pressure.stdDev());
        return enriched;
    }

    record ZScorer(double mean, double stdDev, boolean degenerate) {

        static ZScorer of(List<RawReading> readings, SensorColumn column, DataQualityReport report) {
            double[] values = ColumnStatistics.validValues(readings, column);
            double mean = ColumnStatistics.mean(values);
            double stdDev = ColumnStatistics.populationStdDev(values);
            boolean degenerate = values.length == 0
                    || stdDev <= DEGENERATE_TOLERANCE * Math.max(1.0, Math.abs(mean));
            if (degenerate && !readings.isEmpty()) {
                log.warn("Column {} has zero variance over {} values, Z-scores set to 0",
                        column.getValue(), values.length);
                report.record(DataIssue.of(DataIssueType.DEGENERATE_COLUMN, column,
                        "zero variance, Z-scores set to 0"));
            }
            return new ZScorer(mean, stdDev, degenerate);
        }

        double score(double value) {
            if (degenerate || Double.isNaN(value)) {
                return 0.0;
            }
            return (value - mean) / stdDev;
        }
    }
}
