package com.sensor.etl.transform;

import com.sensor.common.model.RawReading;
import com.sensor.common.model.SensorColumn;
import com.sensor.etl.quality.DataIssue;
import com.sensor.etl.quality.DataIssueType;
import com.sensor.etl.quality.DataQualityReport;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Replaces IQR outliers and imputes missing values, column by column.
 * <p>
 * For every numeric column:
 * <ol>
 *   <li>values strictly outside {@code [Q1 - 1.5 IQR, Q3 + 1.5 IQR]} are replaced with the median
 *       of the in-band values (skipped when fewer than {@value #MIN_VALUES_FOR_IQR} values are present);</li>
 *   <li>missing values are replaced with the median of all valid values, taken before step 1;</li>
 *   <li>a column with no valid value at all is filled with 0.</li>
 * </ol>
 * Reading count and order are preserved.
 */
@Slf4j
public class ReadingCleaner {

    static final int MIN_VALUES_FOR_IQR = 4;
    static final double IQR_MULTIPLIER = 1.5;

    public List<RawReading> clean(List<RawReading> readings) {
        return clean(readings, new DataQualityReport());
    }

    public List<RawReading> clean(List<RawReading> readings, DataQualityReport report) {
        List<RawReading> cleaned = new ArrayList<>(readings);
        if (cleaned.isEmpty()) {
            return cleaned;
        }
        for (SensorColumn column : SensorColumn.values()) {
            cleanColumn(cleaned, column, report);
        }
        return cleaned;
    }

    private void cleanColumn(List<RawReading> readings, SensorColumn column, DataQualityReport report) {
        double[] valid = ColumnStatistics.validValues(readings, column);

        if (valid.length == 0) {
            log.warn("Column {} has no valid values, imputing 0 for {} readings", column.getValue(), readings.size());
            report.record(DataIssue.of(DataIssueType.DEGENERATE_COLUMN, column,
                    "no valid values, imputed 0"));
            readings.replaceAll(reading -> reading.with(column, 0.0));
            report.recordImputed(column, readings.size());
            return;
        }

        double fillValue = ColumnStatistics.median(valid);
        double lowerBound = Double.NEGATIVE_INFINITY;
        double upperBound = Double.POSITIVE_INFINITY;
        double replacement = Double.NaN;

        if (valid.length >= MIN_VALUES_FOR_IQR) {
            double q1 = ColumnStatistics.quantile(valid, 0.25);
            double q3 = ColumnStatistics.quantile(valid, 0.75);
            double iqr = q3 - q1;
            lowerBound = q1 - IQR_MULTIPLIER * iqr;
            upperBound = q3 + IQR_MULTIPLIER * iqr;

            double low = lowerBound;
            double high = upperBound;
            replacement = ColumnStatistics.median(Arrays.stream(valid)
                    .filter(value -> value >= low && value <= high)
                    .toArray());
        } else {
            log.debug("Column {} has {} valid values, skipping outlier detection", column.getValue(), valid.length);
        }

        int outliers = 0;
        int imputed = 0;
        for (int i = 0; i < readings.size(); i++) {
            RawReading reading = readings.get(i);
            double value = column.read(reading);
            if (Double.isNaN(value)) {
                readings.set(i, reading.with(column, fillValue));
                imputed++;
            } else if ((value < lowerBound || value > upperBound) && !Double.isNaN(replacement)) {
                readings.set(i, reading.with(column, replacement));
                outliers++;
            }
        }

        if (outliers > 0) {
            log.info("Replaced {} outliers in {} outside [{}, {}] with {}",
                    outliers, column.getValue(), lowerBound, upperBound, replacement);
            report.recordOutliers(column, outliers);
        }
        if (imputed > 0) {
            log.info("Imputed {} missing {} values with median {}", imputed, column.getValue(), fillValue);
            report.recordImputed(column, imputed);
        }
    }
}
